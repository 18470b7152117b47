package com.example.tssconverter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TssConverterApplication {

    public static void main(String[] args) {
        SpringApplication.run(TssConverterApplication.class, args);
    }
}
