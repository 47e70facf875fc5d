package com.campaignrl.rlengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RlEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RlEngineApplication.class, args);
    }
}
