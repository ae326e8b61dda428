package com.github.dimitryivaniuta.memoize;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MemoizeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoizeApplication.class, args);
    }
}
