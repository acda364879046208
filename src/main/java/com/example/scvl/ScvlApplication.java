package com.example.scvl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class ScvlApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScvlApplication.class, args);
    }
}
