package tech.noetzold.zta.validation_api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Validation API")
                        .version("1.0.0")
                        .description("Signal enrichment against reference data and validation into weighted vectors")
                        .contact(new Contact()
                                .name("Noetzold Tech")
                                .email("contato@noetzold.tech")
                                .url("https://noetzold.tech")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8001")
                                .description("Development")))
                .tags(List.of(
                        new Tag().name("Validation").description("Signal validation"),
                        new Tag().name("Reference").description("Reference dataset status and reload")));
    }
}
