package com.gridbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GridBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridBotApplication.class, args);
    }
}
