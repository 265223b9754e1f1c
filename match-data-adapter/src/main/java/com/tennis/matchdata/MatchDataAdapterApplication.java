package com.tennis.matchdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import com.tennis.matchdata.config.SourceProperties;

@SpringBootApplication
@EnableConfigurationProperties(SourceProperties.class)
public class MatchDataAdapterApplication {

    public static void main(String[] args) {
        SpringApplication.run(MatchDataAdapterApplication.class, args);
    }
}
