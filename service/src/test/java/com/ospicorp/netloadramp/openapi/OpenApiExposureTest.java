package com.ospicorp.netloadramp.openapi;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class OpenApiExposureTest {

  @Autowired
  private TestRestTemplate rest;

  @Test
  void openapiYamlServed() {
    ResponseEntity<String> response = rest.getForEntity("/v3/api-docs.yaml", String.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody())
        .contains("openapi:")
        .contains("title: Net Load Ramp API")
        .contains("/v1/ramps")
        .contains("ProblemDetail");
  }

  @Test
  void rampSchemasUseWireNames() {
    String yaml = rest.getForObject("/v3/api-docs.yaml", String.class);
    assertThat(yaml)
        .contains("RampRequest:")
        .contains("RampResponse:")
        .contains("TableDto:")
        .contains("id_columns")
        .contains("time_step")
        .contains("first_weekday");
  }
}
