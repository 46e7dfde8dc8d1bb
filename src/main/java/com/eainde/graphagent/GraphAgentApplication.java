package com.eainde.graphagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class GraphAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphAgentApplication.class, args);
    }
}
