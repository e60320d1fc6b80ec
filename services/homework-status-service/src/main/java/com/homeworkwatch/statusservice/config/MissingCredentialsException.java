package com.homeworkwatch.statusservice.config;

import java.util.List;
import org.springframework.boot.ExitCodeGenerator;

public class MissingCredentialsException extends RuntimeException implements ExitCodeGenerator {

  private final List<String> missing;

  public MissingCredentialsException(List<String> missing) {
    super("Missing required environment variables: " + String.join(", ", missing));
    this.missing = List.copyOf(missing);
  }

  public List<String> getMissing() {
    return missing;
  }

  @Override
  public int getExitCode() {
    return 1;
  }
}
