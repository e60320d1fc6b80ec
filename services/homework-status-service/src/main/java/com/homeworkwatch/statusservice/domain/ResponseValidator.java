package com.homeworkwatch.statusservice.domain;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Проверяет структуру ответа API до того, как из него читаются поля. */
@Component
public class ResponseValidator {

  public static final String HOMEWORKS = "homeworks";
  public static final String CURRENT_DATE = "current_date";

  public List<JsonNode> validate(JsonNode response) {
    if (response == null || !response.isObject()) {
      throw HomeworkStatusException.notAnObject(typeOf(response));
    }

    List<String> missing = new ArrayList<>();
    if (!response.has(HOMEWORKS)) missing.add(HOMEWORKS);
    if (!response.has(CURRENT_DATE)) missing.add(CURRENT_DATE);
    if (!missing.isEmpty()) {
      throw HomeworkStatusException.missingResponseKeys(missing);
    }

    JsonNode homeworks = response.get(HOMEWORKS);
    if (!homeworks.isArray()) {
      throw HomeworkStatusException.homeworksNotAList(typeOf(homeworks));
    }

    List<JsonNode> out = new ArrayList<>(homeworks.size());
    homeworks.forEach(out::add);
    return out;
  }

  static String typeOf(JsonNode node) {
    return node == null ? "NULL" : node.getNodeType().name();
  }
}
