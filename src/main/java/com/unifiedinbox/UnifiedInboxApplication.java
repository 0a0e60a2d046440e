package com.unifiedinbox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UnifiedInboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(UnifiedInboxApplication.class, args);
    }
}
