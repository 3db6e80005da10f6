package com.graphmend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GraphMendApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphMendApplication.class, args);
    }
}
