package dev.interviewresearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InterviewResearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(InterviewResearchApplication.class, args);
    }
}
