package com.example.datachat;

import com.example.datachat.config.AnalysisProperties;
import com.example.datachat.config.ChatQueueProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AnalysisProperties.class, ChatQueueProperties.class})
public class DataChatApplication {
    public static void main(String[] args) {
        SpringApplication.run(DataChatApplication.class, args);
    }
}
