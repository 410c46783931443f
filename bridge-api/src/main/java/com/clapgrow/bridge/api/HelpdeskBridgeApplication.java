package com.clapgrow.bridge.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.web.reactive.WebFluxAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(exclude = {
    WebFluxAutoConfiguration.class  // WebClient only; the REST surface is Spring MVC
})
@EnableScheduling
public class HelpdeskBridgeApplication {
    public static void main(String[] args) {
        SpringApplication.run(HelpdeskBridgeApplication.class, args);
    }
}
