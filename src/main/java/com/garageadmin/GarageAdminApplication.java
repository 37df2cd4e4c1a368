package com.garageadmin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GarageAdminApplication {

    public static void main(String[] args) {
        SpringApplication.run(GarageAdminApplication.class, args);
    }
}
