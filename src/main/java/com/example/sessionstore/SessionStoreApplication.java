package com.example.sessionstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SessionStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionStoreApplication.class, args);
    }
}
