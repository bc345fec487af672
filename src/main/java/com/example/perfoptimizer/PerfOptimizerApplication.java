package com.example.perfoptimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class PerfOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PerfOptimizerApplication.class, args);
    }
}
