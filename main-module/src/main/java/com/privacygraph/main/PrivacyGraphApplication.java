package com.privacygraph.main;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.privacygraph")
public class PrivacyGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrivacyGraphApplication.class, args);
    }
}
