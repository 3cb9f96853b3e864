package dev.sitesage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SiteSageApplication {

    public static void main(String[] args) {
        SpringApplication.run(SiteSageApplication.class, args);
    }
}
