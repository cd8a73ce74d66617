package com.example.handwritingcomparator;

import com.example.handwritingcomparator.config.ComparatorProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Handwriting Comparator API",
                version = "1.0",
                description = "REST API for comparing a questioned handwriting specimen against a known reference sample.",
                contact = @Contact(name = "Handwriting Comparator")))
@SpringBootApplication
@EnableConfigurationProperties(ComparatorProperties.class)
public class HandwritingComparatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(HandwritingComparatorApplication.class, args);
    }
}
