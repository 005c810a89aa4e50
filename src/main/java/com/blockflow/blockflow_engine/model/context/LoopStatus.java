package com.blockflow.blockflow_engine.model.context;

public enum LoopStatus {
    PENDING,
    ITERATING,
    COMPLETED
}
