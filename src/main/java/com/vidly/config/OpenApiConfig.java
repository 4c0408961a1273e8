package com.vidly.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI vidlyOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Vidly API")
                .description("REST API for a video rental store: genres, movies, customers, "
                    + "users, and rentals with atomic stock accounting.")
                .version("1.0.0"))
            .components(new Components()
                .addSecuritySchemes("x-auth-token", new SecurityScheme()
                    .type(SecurityScheme.Type.APIKEY)
                    .in(SecurityScheme.In.HEADER)
                    .name("x-auth-token")));
    }
}
