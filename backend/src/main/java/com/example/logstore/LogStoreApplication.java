package com.example.logstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class LogStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogStoreApplication.class, args);
    }

}
