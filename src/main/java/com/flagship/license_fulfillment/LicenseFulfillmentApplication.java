package com.flagship.license_fulfillment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the license fulfillment service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class LicenseFulfillmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(LicenseFulfillmentApplication.class, args);
    }
}
