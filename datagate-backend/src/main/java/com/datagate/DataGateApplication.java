package com.datagate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DataGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataGateApplication.class, args);
    }
}
