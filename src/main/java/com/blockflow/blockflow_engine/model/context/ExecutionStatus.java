package com.blockflow.blockflow_engine.model.context;

public enum ExecutionStatus {
    RUNNING,
    SUCCESS,
    FAILURE,
    CANCELLED
}
