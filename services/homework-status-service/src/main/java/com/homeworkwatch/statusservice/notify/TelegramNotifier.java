package com.homeworkwatch.statusservice.notify;

import com.homeworkwatch.statusservice.client.TelegramBotClient;
import com.homeworkwatch.statusservice.client.TelegramClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Доставляет сообщения в чат и никогда не пробрасывает ошибку доставки наружу: цикл опроса может
 * как раз сообщать о сбое, из-за которого не работает отправка.
 */
@Service
@Slf4j
public class TelegramNotifier {

  private final TelegramBotClient bot;

  public TelegramNotifier(TelegramBotClient bot) {
    this.bot = bot;
  }

  /** Возвращает {@code true}, если Telegram принял сообщение. */
  public boolean notify(String chatId, String message) {
    try {
      bot.sendMessage(chatId, message);
      log.debug("Message sent to chatId={}: {}", chatId, message);
      return true;
    } catch (TelegramClientException e) {
      log.error("Failed to send Telegram message to chatId={}: {}", chatId, e.getMessage());
      return false;
    } catch (RuntimeException e) {
      log.error("Unexpected error while sending Telegram message to chatId={}", chatId, e);
      return false;
    }
  }
}
