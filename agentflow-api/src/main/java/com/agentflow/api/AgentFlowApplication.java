package com.agentflow.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for AgentFlow.
 */
@SpringBootApplication(scanBasePackages = {
    "com.agentflow.api",
    "com.agentflow.engine"
})
public class AgentFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentFlowApplication.class, args);
    }
}
