package com.example.playout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlayoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlayoutApplication.class, args);
    }
}
