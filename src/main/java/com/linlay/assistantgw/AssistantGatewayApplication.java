package com.linlay.assistantgw;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AssistantGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssistantGatewayApplication.class, args);
    }
}
