package com.demo.messaging;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MessagingServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MessagingServerApplication.class, args);
    }
}
