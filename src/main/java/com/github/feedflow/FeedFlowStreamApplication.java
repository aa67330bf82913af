package com.github.feedflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class FeedFlowStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeedFlowStreamApplication.class, args);
    }
}
