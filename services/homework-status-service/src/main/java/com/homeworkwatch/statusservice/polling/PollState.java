package com.homeworkwatch.statusservice.polling;

/** Mutable loop state. Confined to the scheduler thread that runs the poller. */
final class PollState {

  private long timestamp;
  private String lastReportedError;

  PollState(long timestamp) {
    this.timestamp = timestamp;
  }

  long timestamp() {
    return timestamp;
  }

  void advanceTo(long timestamp) {
    this.timestamp = timestamp;
  }

  String lastReportedError() {
    return lastReportedError;
  }

  void markReported(String error) {
    this.lastReportedError = error;
  }
}
