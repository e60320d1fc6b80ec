package com.homeworkwatch.statusservice.domain;

import java.util.List;
import org.springframework.core.NestedExceptionUtils;

/**
 * Единый тип ошибки одной итерации опроса. Вид ошибки задаётся {@link ErrorKind}; цикл опроса
 * обрабатывает все виды одинаково.
 */
public class HomeworkStatusException extends RuntimeException {

  private final ErrorKind kind;
  private final List<String> missingKeys;
  private final String observed;

  private HomeworkStatusException(
      ErrorKind kind, String message, List<String> missingKeys, String observed, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.missingKeys = missingKeys == null ? List.of() : List.copyOf(missingKeys);
    this.observed = observed;
  }

  public static HomeworkStatusException requestFailed(String endpoint, Throwable cause) {
    Throwable root = NestedExceptionUtils.getMostSpecificCause(cause);
    String reason = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    return new HomeworkStatusException(
        ErrorKind.API_REQUEST,
        "Endpoint " + endpoint + " is unreachable: " + reason,
        null,
        null,
        cause);
  }

  public static HomeworkStatusException unexpectedStatus(String endpoint, int statusCode) {
    return new HomeworkStatusException(
        ErrorKind.API_REQUEST,
        "Endpoint " + endpoint + " is unavailable. Response code: " + statusCode,
        null,
        Integer.toString(statusCode),
        null);
  }

  public static HomeworkStatusException parseFailed(String details, Throwable cause) {
    return new HomeworkStatusException(
        ErrorKind.PARSE, "Failed to parse API response: " + details, null, null, cause);
  }

  public static HomeworkStatusException notAnObject(String observedType) {
    return new HomeworkStatusException(
        ErrorKind.INVALID_RESPONSE,
        "API response is not a JSON object: " + observedType,
        null,
        observedType,
        null);
  }

  public static HomeworkStatusException missingResponseKeys(List<String> keys) {
    return new HomeworkStatusException(
        ErrorKind.INVALID_RESPONSE,
        "API response is missing keys: " + String.join(", ", keys),
        keys,
        null,
        null);
  }

  public static HomeworkStatusException homeworksNotAList(String observedType) {
    return new HomeworkStatusException(
        ErrorKind.INVALID_RESPONSE,
        "Field 'homeworks' is not a list: " + observedType,
        null,
        observedType,
        null);
  }

  public static HomeworkStatusException missingFields(List<String> keys) {
    return new HomeworkStatusException(
        ErrorKind.MISSING_FIELD,
        "Homework record is missing keys: " + String.join(", ", keys),
        keys,
        null,
        null);
  }

  public static HomeworkStatusException unknownStatus(String status) {
    return new HomeworkStatusException(
        ErrorKind.UNKNOWN_STATUS, "Unknown homework status: " + status, null, status, null);
  }

  public ErrorKind getKind() {
    return kind;
  }

  /** Keys absent from a response or a homework record; empty for other kinds. */
  public List<String> getMissingKeys() {
    return missingKeys;
  }

  /** Observed JSON type, status code or status value, if the kind has one. */
  public String getObserved() {
    return observed;
  }
}
