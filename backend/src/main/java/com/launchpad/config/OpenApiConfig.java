package com.launchpad.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI document served at /api/docs-json, with Swagger UI at /api/docs.
 */
@Configuration
public class OpenApiConfig {

    static final String JOB_BOARD_SCHEME = "jobBoardBasic";

    @Value("${app.name:Launchpad}")
    private String appName;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title(appName + " API")
                        .version("1.0")
                        .description("Verification challenges, job queue dashboard and service health"))
                .components(new Components()
                        .addSecuritySchemes(JOB_BOARD_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("basic")
                                .description("Job board operator credentials")));
    }
}
