package com.homeworkwatch.statusservice.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.homeworkwatch.statusservice.config.Credentials;
import java.util.HashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class TelegramBotClient {

  /** Telegram rejects texts longer than this. */
  public static final int MAX_MESSAGE_LENGTH = 4096;

  private final RestClient rest;
  private final String botToken;

  public TelegramBotClient(
      @Qualifier("telegramRestClient") RestClient rest, Credentials credentials) {
    this.rest = rest;
    this.botToken = credentials.telegramToken();
  }

  /**
   * Sends a plain text message.
   *
   * @throws TelegramClientException on transport errors, non-2xx replies and {@code "ok": false}
   */
  public void sendMessage(String chatId, String text) {
    Map<String, Object> body = new HashMap<>();
    body.put("chat_id", chatId);
    body.put("text", truncate(text));

    JsonNode reply;
    try {
      reply =
          rest.post()
              .uri("/bot{token}/sendMessage", botToken)
              .body(body)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientResponseException e) {
      // the exception message carries the request URL, and with it the bot token
      throw new TelegramClientException(
          "Telegram API responded with status "
              + e.getStatusCode().value()
              + ": "
              + e.getResponseBodyAsString());
    } catch (RestClientException e) {
      Throwable root = NestedExceptionUtils.getMostSpecificCause(e);
      String reason = root.getClass().getSimpleName() + ": " + root.getMessage();
      throw new TelegramClientException("Telegram API is unreachable: " + reason, root);
    }

    if (reply == null || !reply.path("ok").asBoolean(false)) {
      String description =
          reply == null ? "empty reply" : reply.path("description").asText("no description");
      throw new TelegramClientException("Telegram rejected the message: " + description);
    }
  }

  static String truncate(String text) {
    if (text == null) return "";
    if (text.length() <= MAX_MESSAGE_LENGTH) return text;
    int end = MAX_MESSAGE_LENGTH - 1;
    // do not split a surrogate pair
    if (Character.isHighSurrogate(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(0, end) + "…";
  }
}
