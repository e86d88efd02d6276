package com.github.dimitryivaniuta.responsecache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResponseCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResponseCacheApplication.class, args);
    }
}
