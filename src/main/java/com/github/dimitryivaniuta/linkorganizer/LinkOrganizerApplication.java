package com.github.dimitryivaniuta.linkorganizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class LinkOrganizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinkOrganizerApplication.class, args);
    }
}
