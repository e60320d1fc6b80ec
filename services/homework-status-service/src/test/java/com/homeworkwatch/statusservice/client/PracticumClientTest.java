package com.homeworkwatch.statusservice.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.homeworkwatch.statusservice.config.Credentials;
import com.homeworkwatch.statusservice.config.PracticumProperties;
import com.homeworkwatch.statusservice.domain.ErrorKind;
import com.homeworkwatch.statusservice.domain.HomeworkStatusException;
import java.net.ConnectException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class PracticumClientTest {

  private static final String ENDPOINT = "https://practicum.test/api/user_api/homework_statuses/";

  private MockRestServiceServer server;
  private PracticumClient client;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    client =
        new PracticumClient(
            builder.build(),
            new ObjectMapper(),
            new PracticumProperties(
                "practicum-token", ENDPOINT, Duration.ofSeconds(1), Duration.ofSeconds(1)),
            new Credentials("practicum-token", "bot-token", "42"));
  }

  @Test
  void fetchStatus_sendsCursorAndOAuthHeader() {
    server
        .expect(requestTo(ENDPOINT + "?from_date=1000"))
        .andExpect(method(HttpMethod.GET))
        .andExpect(header("Authorization", "OAuth practicum-token"))
        .andRespond(
            withSuccess(
                "{\"homeworks\": [{\"homework_name\": \"proj1\", \"status\": \"approved\"}],"
                    + " \"current_date\": 2000}",
                MediaType.APPLICATION_JSON));

    JsonNode response = client.fetchStatus(1000);

    assertThat(response.path("current_date").asLong()).isEqualTo(2000);
    assertThat(response.path("homeworks").get(0).path("status").asText()).isEqualTo("approved");
    server.verify();
  }

  @Test
  void fetchStatus_returnsShapeUnchecked() {
    server
        .expect(requestTo(ENDPOINT + "?from_date=0"))
        .andRespond(withSuccess("[1, 2]", MediaType.APPLICATION_JSON));

    assertThat(client.fetchStatus(0).isArray()).isTrue();
  }

  @Test
  void serverError_isApiRequestErrorWithStatusCode() {
    server
        .expect(requestTo(ENDPOINT + "?from_date=5"))
        .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

    HomeworkStatusException e =
        catchThrowableOfType(() -> client.fetchStatus(5), HomeworkStatusException.class);

    assertThat(e.getKind()).isEqualTo(ErrorKind.API_REQUEST);
    assertThat(e.getObserved()).isEqualTo("503");
    assertThat(e.getMessage())
        .isEqualTo("Endpoint " + ENDPOINT + " is unavailable. Response code: 503");
  }

  @Test
  void nonOkSuccessStatus_isApiRequestError() {
    server
        .expect(requestTo(ENDPOINT + "?from_date=5"))
        .andRespond(
            withStatus(HttpStatus.ACCEPTED)
                .body("{\"homeworks\": [], \"current_date\": 1}")
                .contentType(MediaType.APPLICATION_JSON));

    HomeworkStatusException e =
        catchThrowableOfType(() -> client.fetchStatus(5), HomeworkStatusException.class);

    assertThat(e.getKind()).isEqualTo(ErrorKind.API_REQUEST);
    assertThat(e.getObserved()).isEqualTo("202");
  }

  @Test
  void connectionFailure_isApiRequestErrorWrappingCause() {
    server
        .expect(requestTo(ENDPOINT + "?from_date=5"))
        .andRespond(withException(new ConnectException("Connection refused")));

    HomeworkStatusException e =
        catchThrowableOfType(() -> client.fetchStatus(5), HomeworkStatusException.class);

    assertThat(e.getKind()).isEqualTo(ErrorKind.API_REQUEST);
    assertThat(e.getCause()).isNotNull();
    assertThat(e).hasRootCauseInstanceOf(ConnectException.class);
    assertThat(e.getMessage())
        .isEqualTo("Endpoint " + ENDPOINT + " is unreachable: Connection refused");
  }

  @Test
  void malformedBody_isParseError() {
    server
        .expect(requestTo(ENDPOINT + "?from_date=5"))
        .andRespond(withSuccess("<html>oops</html>", MediaType.TEXT_HTML));

    HomeworkStatusException e =
        catchThrowableOfType(() -> client.fetchStatus(5), HomeworkStatusException.class);

    assertThat(e.getKind()).isEqualTo(ErrorKind.PARSE);
    assertThat(e.getCause()).isNotNull();
    assertThat(e.getMessage()).startsWith("Failed to parse API response: ");
  }

  @Test
  void emptyBody_isParseError() {
    server.expect(requestTo(ENDPOINT + "?from_date=5")).andRespond(withStatus(HttpStatus.OK));

    HomeworkStatusException e =
        catchThrowableOfType(() -> client.fetchStatus(5), HomeworkStatusException.class);

    assertThat(e.getKind()).isEqualTo(ErrorKind.PARSE);
    assertThat(e.getMessage()).isEqualTo("Failed to parse API response: empty body");
  }
}
