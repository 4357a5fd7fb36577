package tech.noetzold.zta.validation_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ValidationApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ValidationApiApplication.class, args);
    }
}
