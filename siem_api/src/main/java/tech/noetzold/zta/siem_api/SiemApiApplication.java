package tech.noetzold.zta.siem_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SiemApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(SiemApiApplication.class, args);
    }
}
