package com.waplus.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WaplusDashboardApplication {
    public static void main(String[] args) {
        SpringApplication.run(WaplusDashboardApplication.class, args);
    }
}
