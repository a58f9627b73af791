package com.linlay.skillplatform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SkillPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillPlatformApplication.class, args);
    }
}
