package com.homeworkwatch.statusservice.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "homework.practicum")
public record PracticumProperties(
    String token, String endpoint, Duration connectTimeout, Duration readTimeout) {}
