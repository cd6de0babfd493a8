package com.example.solarcast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SolarForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(SolarForecastApplication.class, args);
    }
}
