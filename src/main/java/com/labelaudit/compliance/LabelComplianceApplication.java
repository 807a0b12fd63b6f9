package com.labelaudit.compliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LabelComplianceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LabelComplianceApplication.class, args);
    }
}
