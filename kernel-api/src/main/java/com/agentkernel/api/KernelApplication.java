package com.agentkernel.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the agent kernel.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@ComponentScan(basePackages = {
    "com.agentkernel.api",
    "com.agentkernel.engine"
})
public class KernelApplication {

    public static void main(String[] args) {
        SpringApplication.run(KernelApplication.class, args);
    }
}
