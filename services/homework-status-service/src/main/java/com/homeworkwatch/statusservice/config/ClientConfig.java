package com.homeworkwatch.statusservice.config;

import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@Slf4j
public class ClientConfig {

  private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

  @Bean
  public Credentials credentials(PracticumProperties practicum, TelegramProperties telegram) {
    try {
      return Credentials.require(practicum.token(), telegram.token(), telegram.chatId());
    } catch (MissingCredentialsException e) {
      log.error(e.getMessage());
      throw e;
    }
  }

  @Bean
  public RestClient practicumRestClient(
      RestClient.Builder builder, PracticumProperties properties) {
    return builder
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  public RestClient telegramRestClient(RestClient.Builder builder, TelegramProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  private static ClientHttpRequestFactory requestFactory(
      Duration connectTimeout, Duration readTimeout) {
    ClientHttpRequestFactorySettings settings =
        ClientHttpRequestFactorySettings.DEFAULTS
            .withConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout)
            .withReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
    return ClientHttpRequestFactories.get(settings);
  }
}
