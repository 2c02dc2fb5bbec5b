package com.example.demo.deckgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class DeckgenApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeckgenApplication.class, args);
    }
}
