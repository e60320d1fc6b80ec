package com.homeworkwatch.statusservice.domain;

import java.util.Optional;

public enum HomeworkVerdict {
  APPROVED("approved", "Работа проверена: ревьюеру всё понравилось. Ура!"),
  REVIEWING("reviewing", "Работа взята на проверку ревьюером."),
  REJECTED("rejected", "Работа проверена: у ревьюера есть замечания.");

  private final String code;
  private final String text;

  HomeworkVerdict(String code, String text) {
    this.code = code;
    this.text = text;
  }

  public String code() {
    return code;
  }

  public String text() {
    return text;
  }

  public static Optional<HomeworkVerdict> fromCode(String code) {
    if (code == null) return Optional.empty();
    for (HomeworkVerdict verdict : values()) {
      if (verdict.code.equals(code)) {
        return Optional.of(verdict);
      }
    }
    return Optional.empty();
  }
}
