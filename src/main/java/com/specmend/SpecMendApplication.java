package com.specmend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpecMendApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpecMendApplication.class, args);
    }
}
