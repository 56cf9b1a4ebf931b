package com.receipt.extraction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ReceiptExtractionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReceiptExtractionApplication.class, args);
    }
}
