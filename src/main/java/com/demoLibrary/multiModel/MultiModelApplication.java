package com.demoLibrary.multiModel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MultiModelApplication {

    public static void main(String[] args) {
        SpringApplication.run(MultiModelApplication.class, args);
    }
}
