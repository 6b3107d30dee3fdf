package com.dfsoptimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DfsOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DfsOptimizerApplication.class, args);
    }
}
