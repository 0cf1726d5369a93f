package com.wordhmm.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WordHmmServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WordHmmServerApplication.class, args);
    }
}
