package com.herzen.completion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CompletionAggregatorApplication {
    public static void main(String[] args) {
        SpringApplication.run(CompletionAggregatorApplication.class, args);
    }
}
