package com.example.support;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SupportTicketRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(SupportTicketRouterApplication.class, args);
    }
}
