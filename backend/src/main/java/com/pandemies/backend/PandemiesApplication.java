package com.pandemies.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PandemiesApplication {

    public static void main(String[] args) {
        // Session expiry is compared in UTC; keep JVM default aligned for logs.
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        SpringApplication.run(PandemiesApplication.class, args);
    }
}
