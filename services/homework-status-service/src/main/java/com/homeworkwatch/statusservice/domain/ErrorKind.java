package com.homeworkwatch.statusservice.domain;

public enum ErrorKind {
  /** Remote API unreachable or answered with a non-200 status. */
  API_REQUEST,
  /** Body is not valid JSON. */
  PARSE,
  /** Well-formed JSON of the wrong shape. */
  INVALID_RESPONSE,
  MISSING_FIELD,
  UNKNOWN_STATUS
}
