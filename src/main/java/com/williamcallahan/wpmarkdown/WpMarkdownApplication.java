package com.williamcallahan.wpmarkdown;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WpMarkdownApplication {

    public static void main(String[] args) {
        SpringApplication.run(WpMarkdownApplication.class, args);
    }

}
