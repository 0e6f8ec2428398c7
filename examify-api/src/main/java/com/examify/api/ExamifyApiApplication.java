package com.examify.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.examify")
@EntityScan("com.examify.data.entity")
@EnableJpaRepositories("com.examify.data.repository")
public class ExamifyApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExamifyApiApplication.class, args);
    }
}
