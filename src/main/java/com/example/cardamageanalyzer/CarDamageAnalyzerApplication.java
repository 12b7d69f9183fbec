package com.example.cardamageanalyzer;

import com.example.cardamageanalyzer.config.AnalyzerProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Car Damage Analyzer API",
                version = "1.0",
                description = "REST API for normalizing vehicle photos and estimating damage across a batch of images.",
                contact = @Contact(name = "Car Damage Analyzer")))
@SpringBootApplication
@EnableConfigurationProperties(AnalyzerProperties.class)
public class CarDamageAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CarDamageAnalyzerApplication.class, args);
    }
}
