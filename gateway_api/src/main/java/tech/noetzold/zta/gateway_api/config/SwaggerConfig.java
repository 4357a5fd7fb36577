package tech.noetzold.zta.gateway_api.config;

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
                        .title("Gateway API")
                        .version("1.0.0")
                        .description("Enforcement gateway: validation, alert aggregation and trust scoring into an allow, step-up or deny decision")
                        .contact(new Contact()
                                .name("Noetzold Tech")
                                .email("contato@noetzold.tech")
                                .url("https://noetzold.tech")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8004")
                                .description("Development")))
                .tags(List.of(
                        new Tag().name("Decision").description("Authentication decisions"),
                        new Tag().name("Audit").description("Enforcement records")));
    }
}
