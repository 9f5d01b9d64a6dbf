package com.projectgroup5.arena;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ArenaServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArenaServerApplication.class, args);
    }
}
