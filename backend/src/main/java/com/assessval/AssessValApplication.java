package com.assessval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

@SpringBootApplication
@EnableJpaAuditing
public class AssessValApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssessValApplication.class, args);
    }
}
