package com.namehub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NamehubApplication {
    public static void main(String[] args) {
        SpringApplication.run(NamehubApplication.class, args);
    }
}
