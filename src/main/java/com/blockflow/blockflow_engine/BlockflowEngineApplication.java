package com.blockflow.blockflow_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlockflowEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlockflowEngineApplication.class, args);
    }
}
