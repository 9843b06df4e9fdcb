package com.github.yoep.popcorn;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PopcornDebridApplication {
    public static void main(String[] args) {
        SpringApplication.run(PopcornDebridApplication.class, args);
    }
}
