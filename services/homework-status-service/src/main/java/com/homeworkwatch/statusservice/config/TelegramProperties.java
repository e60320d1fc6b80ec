package com.homeworkwatch.statusservice.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "homework.telegram")
public record TelegramProperties(
    String token, String chatId, String baseUrl, Duration connectTimeout, Duration readTimeout) {}
