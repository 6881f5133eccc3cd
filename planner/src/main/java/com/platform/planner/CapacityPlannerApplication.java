package com.platform.planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Capacity Planner Application
 * 
 * Runs what-if capacity plans against a remote analysis service:
 * - Version-specific scenario compilation
 * - Plan submission, supervision, timeout and retry
 * - REST surface for submitting and managing plans
 */
@SpringBootApplication
public class CapacityPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CapacityPlannerApplication.class, args);
    }
}
