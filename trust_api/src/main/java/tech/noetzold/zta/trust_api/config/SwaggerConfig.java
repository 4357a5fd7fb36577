package tech.noetzold.zta.trust_api.config;

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
                        .title("Trust API")
                        .version("1.0.0")
                        .description("Risk scoring with STRIDE classification and allow, step-up or deny decisions")
                        .contact(new Contact()
                                .name("Noetzold Tech")
                                .email("contato@noetzold.tech")
                                .url("https://noetzold.tech")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8003")
                                .description("Development")))
                .tags(List.of(
                        new Tag().name("Trust").description("Risk scoring")));
    }
}
