package com.example.menuparser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MenuParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(MenuParserApplication.class, args);
    }

}
