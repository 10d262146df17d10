package com.formulagrid.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FormulaGridApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormulaGridApplication.class, args);
    }
}
