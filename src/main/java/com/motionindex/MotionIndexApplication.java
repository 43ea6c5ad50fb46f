package com.motionindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class MotionIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(MotionIndexApplication.class, args);
    }

    /**
     * Scheduling is only needed for the batch job retention sweep.
     */
    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(name = "batch.retention.enabled", havingValue = "true")
    static class SchedulingConfiguration {
    }
}
