package com.nsguard.webhook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NsGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(NsGuardApplication.class, args);
    }
}
