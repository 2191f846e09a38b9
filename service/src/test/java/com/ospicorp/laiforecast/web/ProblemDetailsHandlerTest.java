package com.ospicorp.laiforecast.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ProblemDetailsHandlerTest {

  private static final ParameterizedTypeReference<Map<String, Object>> BODY =
      new ParameterizedTypeReference<Map<String, Object>>() {};

  @Autowired
  private TestRestTemplate rest;

  @Test
  void missingRunReturnsProblemDetail() {
    ResponseEntity<Map<String, Object>> response =
        rest.exchange("/v1/runs/latest", HttpMethod.GET, null, BODY);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    MediaType contentType = Objects.requireNonNull(response.getHeaders().getContentType());
    assertThat(contentType.toString()).contains("application/problem+json");
    Map<String, Object> body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body).containsKeys("type", "title", "status", "detail", "instance");
    assertThat(body.get("detail")).isEqualTo("No run has completed yet");
  }

  @Test
  void unconfiguredRunIsABadRequest() {
    ResponseEntity<Map<String, Object>> response =
        rest.exchange("/v1/runs", HttpMethod.POST, null, BODY);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    Map<String, Object> body = Objects.requireNonNull(response.getBody());
    assertThat(String.valueOf(body.get("detail"))).contains("lai.base-class-map");
  }
}
