package com.agentmeta.evaluation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MetaEvaluationApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetaEvaluationApplication.class, args);
    }
}
