package com.linlay.sessionrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SessionRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionRelayApplication.class, args);
    }
}
