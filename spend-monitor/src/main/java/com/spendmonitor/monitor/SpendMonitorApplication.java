package com.spendmonitor.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpendMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpendMonitorApplication.class, args);
    }
}
