package com.agentboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentboardApplication.class, args);
    }
}
