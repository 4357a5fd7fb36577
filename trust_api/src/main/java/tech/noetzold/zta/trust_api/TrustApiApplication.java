package tech.noetzold.zta.trust_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrustApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrustApiApplication.class, args);
    }
}
