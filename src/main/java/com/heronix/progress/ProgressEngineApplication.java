package com.heronix.progress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.heronix.progress.config.ProgressProperties;

/**
 * Heronix Progress - Academic Progress and Eligibility Policy Engine
 *
 * Computes GPA, federal Satisfactory Academic Progress, graduation eligibility and
 * Latin honors, and runs these evaluations in bulk over student cohorts.
 */
@SpringBootApplication
@EnableConfigurationProperties(ProgressProperties.class)
@EnableAsync
@EnableScheduling
public class ProgressEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProgressEngineApplication.class, args);
    }
}
