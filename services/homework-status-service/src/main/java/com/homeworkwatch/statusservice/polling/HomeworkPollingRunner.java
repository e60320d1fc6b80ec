package com.homeworkwatch.statusservice.polling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic driver for {@link HomeworkStatusPoller}. Fixed delay: the pause starts after the
 * previous iteration has finished, whatever its result. Disabled by
 * homework.polling.enabled=false.
 */
@Component
@Slf4j
@ConditionalOnProperty(
    name = "homework.polling.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class HomeworkPollingRunner {

  private final HomeworkStatusPoller poller;

  public HomeworkPollingRunner(
      HomeworkStatusPoller poller,
      @Value("${homework.polling.retry-period-ms:600000}") long retryPeriodMs) {
    this.poller = poller;
    log.info("Homework polling enabled, retry period {} ms", retryPeriodMs);
  }

  @Scheduled(
      fixedDelayString = "${homework.polling.retry-period-ms:600000}",
      initialDelayString = "${homework.polling.initial-delay-ms:0}")
  public void poll() {
    try {
      PollOutcome outcome = poller.pollOnce();
      log.debug("Poll finished: {} (cursor={})", outcome.type(), outcome.cursor());
    } catch (Exception e) {
      log.error("Homework polling failed: {}", e.getMessage(), e);
    }
  }
}
