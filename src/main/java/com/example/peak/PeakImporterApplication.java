package com.example.peak;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PeakImporterApplication {

    public static void main(String[] args) {
        SpringApplication.run(PeakImporterApplication.class, args);
    }
}
