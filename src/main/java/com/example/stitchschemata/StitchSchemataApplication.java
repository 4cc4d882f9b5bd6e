package com.example.stitchschemata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StitchSchemataApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(StitchSchemataApplication.class, args)));
    }
}
