package com.mentorship.scheduling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.mentorship.scheduling")
@EnableJpaRepositories(basePackages = "com.mentorship.scheduling.repository")
@EntityScan(basePackages = "com.mentorship.scheduling.entity")
public class SchedulingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchedulingApplication.class, args);
    }
}
