package com.example.LlmCouncil.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "LLM Council API",
                version = "v1",
                description = "Token auction, chairman arbitration and settlement for multi-model answers. "
                        + "Stream endpoints emit one SSE event per stage boundary, named after the event type."
        ),
        tags = {
                @Tag(name = "conversations", description = "Conversations, council runs and settlement history"),
                @Tag(name = "auction", description = "Standalone token auction for cost previews")
        }
)
public class OpenApiConfig {
}
