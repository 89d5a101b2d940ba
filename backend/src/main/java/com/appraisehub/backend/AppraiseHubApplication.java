package com.appraisehub.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AppraiseHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(AppraiseHubApplication.class, args);
    }
}
