package com.ai.bookingbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BookingBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookingBotApplication.class, args);
    }
}
