package com.openrangelabs.copilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CopilotConnectorsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CopilotConnectorsApplication.class, args);
    }

}
