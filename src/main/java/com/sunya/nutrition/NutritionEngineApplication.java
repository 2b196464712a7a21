package com.sunya.nutrition;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NutritionEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(NutritionEngineApplication.class, args);
    }
}
