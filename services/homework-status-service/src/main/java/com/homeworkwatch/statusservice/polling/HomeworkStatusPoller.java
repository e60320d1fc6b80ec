package com.homeworkwatch.statusservice.polling;

import com.fasterxml.jackson.databind.JsonNode;
import com.homeworkwatch.statusservice.client.PracticumClient;
import com.homeworkwatch.statusservice.config.Credentials;
import com.homeworkwatch.statusservice.domain.ResponseValidator;
import com.homeworkwatch.statusservice.domain.StatusFormatter;
import com.homeworkwatch.statusservice.notify.TelegramNotifier;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Одна итерация цикла: запрос к API, проверка ответа, форматирование и отправка уведомления.
 *
 * <p>Сообщается только первая работа из списка; остальные в этой итерации пропускаются. Одинаковые
 * ошибки подряд отправляются в чат один раз, пока текст ошибки не изменится.
 */
@Service
@Slf4j
public class HomeworkStatusPoller {

  static final String FAILURE_PREFIX = "Program failure: ";

  private final PracticumClient practicum;
  private final ResponseValidator validator;
  private final StatusFormatter formatter;
  private final TelegramNotifier notifier;
  private final String chatId;
  private final PollState state;

  public HomeworkStatusPoller(
      PracticumClient practicum,
      ResponseValidator validator,
      StatusFormatter formatter,
      TelegramNotifier notifier,
      Credentials credentials,
      Clock clock) {
    this.practicum = practicum;
    this.validator = validator;
    this.formatter = formatter;
    this.notifier = notifier;
    this.chatId = credentials.telegramChatId();
    this.state = new PollState(clock.instant().getEpochSecond());
    log.info(
        "Tracking homework statuses at {} for chatId={} from {}",
        practicum.endpoint(),
        chatId,
        state.timestamp());
  }

  public PollOutcome pollOnce() {
    try {
      return checkStatuses();
    } catch (Exception e) {
      return reportFailure(e);
    }
  }

  private PollOutcome checkStatuses() {
    JsonNode response = practicum.fetchStatus(state.timestamp());
    List<JsonNode> homeworks = validator.validate(response);

    PollOutcome.Type type;
    String message = null;
    if (homeworks.isEmpty()) {
      log.debug("No new homework statuses since {}", state.timestamp());
      type = PollOutcome.Type.NO_UPDATES;
    } else {
      if (homeworks.size() > 1) {
        log.debug("{} statuses received, reporting only the first one", homeworks.size());
      }
      message = formatter.format(homeworks.get(0));
      type =
          notifier.notify(chatId, message)
              ? PollOutcome.Type.STATUS_NOTIFIED
              : PollOutcome.Type.STATUS_NOT_DELIVERED;
    }

    advanceCursor(response.get(ResponseValidator.CURRENT_DATE));
    return new PollOutcome(type, state.timestamp(), message);
  }

  private void advanceCursor(JsonNode currentDate) {
    if (currentDate == null || !currentDate.isIntegralNumber()) {
      log.warn(
          "current_date is not an integer: {}; cursor stays at {}", currentDate, state.timestamp());
      return;
    }
    long next = currentDate.asLong();
    if (next != state.timestamp()) {
      log.info("Cursor advanced {} -> {}", state.timestamp(), next);
    }
    state.advanceTo(next);
  }

  private PollOutcome reportFailure(Exception error) {
    String message = FAILURE_PREFIX + describe(error);
    log.error(message, error);

    if (Objects.equals(message, state.lastReportedError())) {
      log.debug("Same error already reported, notification skipped");
      return new PollOutcome(PollOutcome.Type.ERROR_SUPPRESSED, state.timestamp(), message);
    }
    if (notifier.notify(chatId, message)) {
      state.markReported(message);
      return new PollOutcome(PollOutcome.Type.ERROR_NOTIFIED, state.timestamp(), message);
    }
    return new PollOutcome(PollOutcome.Type.ERROR_NOT_DELIVERED, state.timestamp(), message);
  }

  private static String describe(Exception error) {
    String text = error.getMessage();
    return text == null || text.isBlank() ? error.getClass().getSimpleName() : text;
  }

  public long cursor() {
    return state.timestamp();
  }

  public String lastReportedError() {
    return state.lastReportedError();
  }
}
