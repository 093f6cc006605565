package com.whereq.gridx;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ GridX.
 * This service vets submitted code with a static analyzer, supervises the
 * resulting jobs and dispatches them to the least loaded worker agent.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class GridxApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridxApplication.class, args);
    }
}
