package com.envelope.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI envelopeOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Envelope Budget API")
                        .description("Envelope budgeting: budgets, allocations and the monthly overview. "
                                + "Amounts are in major currency units with two decimals.")
                        .version("v1")
                        .license(new License().name("Proprietary"))
                );
    }
}
