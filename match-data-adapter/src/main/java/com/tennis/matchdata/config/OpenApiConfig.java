package com.tennis.matchdata.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI matchDataOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Match Data Adapter")
                        .description("Downloads yearly tour and ITF results files, normalizes them " +
                                "and stores one record per match in MongoDB.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:8081").description("Local Dev")
                ));
    }
}
