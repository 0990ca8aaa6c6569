package com.volarb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VolarbApplication {

    public static void main(String[] args) {
        SpringApplication.run(VolarbApplication.class, args);
    }
}
