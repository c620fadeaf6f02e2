package com.example.websearcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WebSearcherApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebSearcherApplication.class, args);
    }
}
