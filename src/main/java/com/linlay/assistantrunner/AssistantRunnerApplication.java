package com.linlay.assistantrunner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AssistantRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssistantRunnerApplication.class, args);
    }
}
