package com.zerarate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ZeraRateApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZeraRateApplication.class, args);
    }
}
