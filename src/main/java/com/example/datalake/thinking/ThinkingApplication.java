package com.example.datalake.thinking;

import com.example.datalake.thinking.config.ThinkingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ThinkingProperties.class)
public class ThinkingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThinkingApplication.class, args);
    }

}
