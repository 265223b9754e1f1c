package com.tennis.rating.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Tennis Rating Engine")
                        .version("1.0.0")
                        .description("Two-speed Elo ratings with form tracking, built from tour and ITF results, and held-out evaluation of the resulting match predictions.")
                        .contact(new Contact().name("Tennis Rating").email("rating@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8082").description("Local Development"),
                        new Server().url("http://rating-engine:8080").description("Docker")
                ));
    }
}
