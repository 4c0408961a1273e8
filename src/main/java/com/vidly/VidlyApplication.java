package com.vidly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VidlyApplication {

    public static void main(String[] args) {
        SpringApplication.run(VidlyApplication.class, args);
    }
}
