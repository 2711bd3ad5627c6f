package com.openforge.mnemo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MnemoApplication {

    public static void main(String[] args) {
        SpringApplication.run(MnemoApplication.class, args);
    }
}
