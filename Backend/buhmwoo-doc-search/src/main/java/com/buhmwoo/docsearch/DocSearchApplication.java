package com.buhmwoo.docsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.buhmwoo.docsearch")
public class DocSearchApplication {
    public static void main(String[] args) {
        SpringApplication.run(DocSearchApplication.class, args);
    }
}
