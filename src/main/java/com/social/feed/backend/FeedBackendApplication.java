package com.social.feed.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FeedBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeedBackendApplication.class, args);
    }
}
