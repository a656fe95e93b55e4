package com.example.procurement.assistantservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpendAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpendAssistantApplication.class, args);
    }
}
