package com.tracemap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TracemapApplication {

    public static void main(String[] args) {
        SpringApplication.run(TracemapApplication.class, args);
    }
}
