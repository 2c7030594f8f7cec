package com.example.bookfetch.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI bookFetchOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Book Fetch API")
                        .description("Audiobook requests, fulfillment jobs and schedules")
                        .version("v1")
                        .contact(new Contact().name("book-fetch")));
    }
}
