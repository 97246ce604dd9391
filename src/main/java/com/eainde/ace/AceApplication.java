package com.eainde.ace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AceApplication.class, args);
    }
}
