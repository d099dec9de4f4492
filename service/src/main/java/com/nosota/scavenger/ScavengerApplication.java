package com.nosota.scavenger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScavengerApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScavengerApplication.class, args);
    }
}
