package com.dkr.optimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DkrOptimizerApplication {
    public static void main(String[] args) {
        SpringApplication.run(DkrOptimizerApplication.class, args);
    }
}
