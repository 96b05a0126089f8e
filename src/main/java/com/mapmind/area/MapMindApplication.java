package com.mapmind.area;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MapMindApplication {

    public static void main(String[] args) {
        SpringApplication.run(MapMindApplication.class, args);
    }
}
