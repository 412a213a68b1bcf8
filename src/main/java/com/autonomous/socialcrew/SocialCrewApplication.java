package com.autonomous.socialcrew;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SocialCrewApplication {

    public static void main(String[] args) {
        SpringApplication.run(SocialCrewApplication.class, args);
    }
}
