package com.tennis.rating;

import com.tennis.rating.config.RatingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RatingProperties.class)
public class RatingEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RatingEngineApplication.class, args);
    }
}
