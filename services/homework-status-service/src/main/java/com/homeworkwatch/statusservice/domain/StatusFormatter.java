package com.homeworkwatch.statusservice.domain;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class StatusFormatter {

  public static final String HOMEWORK_NAME = "homework_name";
  public static final String STATUS = "status";

  public String format(JsonNode homework) {
    List<String> missing = new ArrayList<>();
    if (homework == null || !homework.has(HOMEWORK_NAME)) missing.add(HOMEWORK_NAME);
    if (homework == null || !homework.has(STATUS)) missing.add(STATUS);
    if (!missing.isEmpty()) {
      throw HomeworkStatusException.missingFields(missing);
    }

    String status = homework.get(STATUS).asText();
    HomeworkVerdict verdict =
        HomeworkVerdict.fromCode(status)
            .orElseThrow(() -> HomeworkStatusException.unknownStatus(status));

    String name = homework.get(HOMEWORK_NAME).asText();
    return "Changed review status of \"" + name + "\". " + verdict.text();
  }
}
