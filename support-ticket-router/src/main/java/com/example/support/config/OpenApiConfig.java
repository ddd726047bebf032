package com.example.support.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI supportOpenApi(@Value("${spring.application.name:support-ticket-router}") String applicationName) {
        return new OpenAPI()
                .info(new Info()
                        .title("Support Ticket Router API")
                        .version("1.0")
                        .description("Staff endpoints of %s for inspecting and closing support tickets. "
                                .formatted(applicationName)
                                + "Conversations themselves run over Socket.IO."))
                .addTagsItem(new Tag().name("tickets").description("Ticket lookup and closure"));
    }

    @Bean
    public GroupedOpenApi ticketApi() {
        return GroupedOpenApi.builder()
                .group("tickets")
                .pathsToMatch("/api/tickets/**")
                .build();
    }
}
