package com.forecastaccuracy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForecastAccuracyApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastAccuracyApplication.class, args);
    }
}
