package com.hypothesis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HypothesisAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(HypothesisAgentApplication.class, args);
    }
}
