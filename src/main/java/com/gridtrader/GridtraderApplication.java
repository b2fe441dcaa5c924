package com.gridtrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GridtraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridtraderApplication.class, args);
    }
}
