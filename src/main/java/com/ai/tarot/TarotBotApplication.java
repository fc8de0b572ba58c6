package com.ai.tarot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;

@SpringBootApplication(scanBasePackages = "com.ai.tarot",
        exclude = {RedisAutoConfiguration.class, RedisRepositoriesAutoConfiguration.class})
public class TarotBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(TarotBotApplication.class, args);
    }
}
