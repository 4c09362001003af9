package com.example.datalake.fieldcheck;

import com.example.datalake.fieldcheck.config.FieldCheckProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(FieldCheckProperties.class)
public class FieldCheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(FieldCheckApplication.class, args);
    }

}
