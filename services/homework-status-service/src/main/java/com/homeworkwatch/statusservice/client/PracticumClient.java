package com.homeworkwatch.statusservice.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.homeworkwatch.statusservice.config.Credentials;
import com.homeworkwatch.statusservice.config.PracticumProperties;
import com.homeworkwatch.statusservice.domain.HomeworkStatusException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Клиент API статусов домашних работ Практикума.
 *
 * <p>Возвращает разобранный JSON без проверки структуры; проверкой занимается {@link
 * com.homeworkwatch.statusservice.domain.ResponseValidator}. Повторов не делает: следующую попытку
 * выполнит цикл опроса.
 */
@Component
@Slf4j
public class PracticumClient {

  private final RestClient rest;
  private final ObjectMapper objectMapper;
  private final String endpoint;
  private final String authorization;

  public PracticumClient(
      @Qualifier("practicumRestClient") RestClient rest,
      ObjectMapper objectMapper,
      PracticumProperties properties,
      Credentials credentials) {
    this.rest = rest;
    this.objectMapper = objectMapper;
    this.endpoint = properties.endpoint();
    this.authorization = "OAuth " + credentials.practicumToken();
  }

  public JsonNode fetchStatus(long fromTimestamp) {
    ResponseEntity<String> response;
    try {
      response =
          rest.get()
              .uri(endpoint + "?from_date={fromDate}", fromTimestamp)
              .header(HttpHeaders.AUTHORIZATION, authorization)
              .retrieve()
              .toEntity(String.class);
    } catch (RestClientResponseException e) {
      throw HomeworkStatusException.unexpectedStatus(endpoint, e.getStatusCode().value());
    } catch (RestClientException e) {
      throw HomeworkStatusException.requestFailed(endpoint, e);
    }

    int status = response.getStatusCode().value();
    if (status != 200) {
      throw HomeworkStatusException.unexpectedStatus(endpoint, status);
    }

    String body = response.getBody();
    if (body == null || body.isBlank()) {
      throw HomeworkStatusException.parseFailed("empty body", null);
    }
    try {
      JsonNode root = objectMapper.readTree(body);
      log.debug("Fetched homework statuses from_date={}", fromTimestamp);
      return root;
    } catch (JsonProcessingException e) {
      throw HomeworkStatusException.parseFailed(e.getOriginalMessage(), e);
    }
  }

  public String endpoint() {
    return endpoint;
  }
}
