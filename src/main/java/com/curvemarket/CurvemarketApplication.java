package com.curvemarket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CurvemarketApplication {

    public static void main(String[] args) {
        SpringApplication.run(CurvemarketApplication.class, args);
    }
}
