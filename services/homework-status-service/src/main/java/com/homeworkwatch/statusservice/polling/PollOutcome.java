package com.homeworkwatch.statusservice.polling;

/** What a single poll iteration did. {@code message} is null for {@link Type#NO_UPDATES}. */
public record PollOutcome(Type type, long cursor, String message) {

  public enum Type {
    STATUS_NOTIFIED,
    STATUS_NOT_DELIVERED,
    NO_UPDATES,
    ERROR_NOTIFIED,
    ERROR_NOT_DELIVERED,
    ERROR_SUPPRESSED
  }

  public boolean failed() {
    return type == Type.ERROR_NOTIFIED
        || type == Type.ERROR_NOT_DELIVERED
        || type == Type.ERROR_SUPPRESSED;
  }
}
