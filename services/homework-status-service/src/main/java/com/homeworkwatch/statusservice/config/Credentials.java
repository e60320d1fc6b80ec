package com.homeworkwatch.statusservice.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Три секрета, без которых сервис не запускается: токен API Практикума, токен Telegram-бота и
 * идентификатор чата получателя.
 */
public record Credentials(String practicumToken, String telegramToken, String telegramChatId) {

  public static final String PRACTICUM_TOKEN = "PRACTICUM_TOKEN";
  public static final String TELEGRAM_TOKEN = "TELEGRAM_TOKEN";
  public static final String TELEGRAM_CHAT_ID = "TELEGRAM_CHAT_ID";

  /**
   * Собирает учётные данные и проверяет, что все три значения заданы.
   *
   * @throws MissingCredentialsException со списком имён всех отсутствующих переменных
   */
  public static Credentials require(
      String practicumToken, String telegramToken, String telegramChatId) {
    List<String> missing = new ArrayList<>();
    if (isBlank(practicumToken)) missing.add(PRACTICUM_TOKEN);
    if (isBlank(telegramToken)) missing.add(TELEGRAM_TOKEN);
    if (isBlank(telegramChatId)) missing.add(TELEGRAM_CHAT_ID);
    if (!missing.isEmpty()) {
      throw new MissingCredentialsException(missing);
    }
    return new Credentials(practicumToken.trim(), telegramToken.trim(), telegramChatId.trim());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  @Override
  public String toString() {
    return "Credentials[telegramChatId=" + telegramChatId + "]";
  }
}
