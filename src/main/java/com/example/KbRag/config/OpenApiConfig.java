package com.example.KbRag.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "KbRag API",
                version = "v1",
                description = "Hybrid retrieval and cited answers over the French knowledge base"
        )
)
public class OpenApiConfig {
}
