package com.id.wattlog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class WattlogApplication {

    public static void main(String[] args) {
        SpringApplication.run(WattlogApplication.class, args);
    }

}
