package com.phillippitts.jobpipeline;

import com.phillippitts.jobpipeline.config.properties.AuthorizationProperties;
import com.phillippitts.jobpipeline.config.properties.JobProperties;
import com.phillippitts.jobpipeline.config.properties.RateLimitProperties;
import com.phillippitts.jobpipeline.config.properties.SessionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        JobProperties.class,
        RateLimitProperties.class,
        SessionProperties.class,
        AuthorizationProperties.class
})
@EnableScheduling
public class JobPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobPipelineApplication.class, args);
    }

}
