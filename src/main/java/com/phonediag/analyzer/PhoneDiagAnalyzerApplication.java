package com.phonediag.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhoneDiagAnalyzerApplication {
    public static void main(String[] args) {
        SpringApplication.run(PhoneDiagAnalyzerApplication.class, args);
    }
}
