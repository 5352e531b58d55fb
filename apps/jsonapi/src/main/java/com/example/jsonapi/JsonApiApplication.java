package com.example.jsonapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JsonApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(JsonApiApplication.class, args);
    }
}
