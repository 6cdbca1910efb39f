package com.keytrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class KeytraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeytraderApplication.class, args);
    }
}
