package com.caremate.triage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.caremate.triage")
@EnableJpaRepositories(basePackages = "com.caremate.triage.repository")
@EntityScan(basePackages = "com.caremate.triage.entity")
@EnableScheduling
public class CareMateTriageApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareMateTriageApplication.class, args);
    }
}
