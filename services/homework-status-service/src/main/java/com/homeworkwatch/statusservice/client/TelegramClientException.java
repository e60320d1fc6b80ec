package com.homeworkwatch.statusservice.client;

public class TelegramClientException extends RuntimeException {
  public TelegramClientException(String message) {
    super(message);
  }

  public TelegramClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
