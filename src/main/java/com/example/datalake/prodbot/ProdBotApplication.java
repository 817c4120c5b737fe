package com.example.datalake.prodbot;

import com.example.datalake.prodbot.config.BotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BotProperties.class)
public class ProdBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProdBotApplication.class, args);
    }

}
