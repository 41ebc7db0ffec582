package com.taskgraph.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application entry point for the TaskGraph engine.
 */
@SpringBootApplication
@EnableScheduling
@ComponentScan(basePackages = {
    "com.taskgraph.server",
    "com.taskgraph.engine",
    "com.taskgraph.scheduler",
    "com.taskgraph.recovery",
    "com.taskgraph.worker"
})
public class TaskGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskGraphApplication.class, args);
    }
}
