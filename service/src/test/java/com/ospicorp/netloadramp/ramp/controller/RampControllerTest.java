package com.ospicorp.netloadramp.ramp.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class RampControllerTest {

  @Autowired
  private TestRestTemplate rest;

  private static Map<String, Object> areaTable() {
    return Map.of(
        "type", "areas",
        "id_columns", List.of("area", "timeId"),
        "columns", List.of("BALANCE", "netLoad"),
        "rows", List.of(
            List.of("fr", 1, 10, 100),
            List.of("fr", 2, 15, 90),
            List.of("fr", 3, 5, 95)));
  }

  private static Map<String, Object> districtTable() {
    return Map.of(
        "type", "districts",
        "id_columns", List.of("district", "timeId"),
        "columns", List.of("BALANCE", "netLoad"),
        "rows", List.of(List.of("north", 1, 1, 20), List.of("north", 2, 3, 25)));
  }

  private ResponseEntity<Map<String, Object>> post(String query, Map<String, Object> body) {
    return rest.exchange("/v1/ramps" + query, HttpMethod.POST, new HttpEntity<>(body),
        new ParameterizedTypeReference<>() {});
  }

  @SuppressWarnings("unchecked")
  private static List<List<Object>> rows(Map<String, Object> table) {
    return (List<List<Object>>) table.get("rows");
  }

  @Test
  @SuppressWarnings("unchecked")
  void hourlyRampsOfSingleTable() {
    var response = post("", Map.of("table", areaTable()));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    var body = response.getBody();
    assertThat(body).containsEntry("time_step", "hourly").containsEntry("synthesis", false);
    var table = (Map<String, Object>) body.get("table");
    assertThat(table).containsEntry("type", "netLoadRamp");
    assertThat((List<String>) table.get("columns"))
        .containsExactly("netLoadRamp", "balanceRamp", "areaRamp");
    var second = rows(table).get(1);
    assertThat(second.get(0)).isEqualTo("fr");
    assertThat(((Number) second.get(1)).intValue()).isEqualTo(2);
    assertThat(((Number) second.get(2)).doubleValue()).isEqualTo(-10d);
    assertThat(((Number) second.get(3)).doubleValue()).isEqualTo(5d);
    assertThat(((Number) second.get(4)).doubleValue()).isEqualTo(-5d);
  }

  @Test
  @SuppressWarnings("unchecked")
  void annualRampsCarryStatistics() {
    var response = post("?time_step=annual", Map.of("table", areaTable()));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    var table = (Map<String, Object>) response.getBody().get("table");
    assertThat((List<String>) table.get("columns")).hasSize(9).startsWith("avg_netLoadRamp");
    var row = rows(table).get(0);
    assertThat(row.get(2)).isEqualTo("Annual");
    assertThat(((Number) row.get(3)).doubleValue()).isCloseTo(-5d / 3, within(1e-9));
    assertThat(((Number) row.get(4)).doubleValue()).isEqualTo(-10d);
    assertThat(((Number) row.get(5)).doubleValue()).isEqualTo(5d);
  }

  @Test
  void containerReturnsOnlyPresentTables() {
    var response = post("", Map.of("districts", districtTable()));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsKey("districts").doesNotContainKeys("areas", "table");
  }

  @Test
  void csvFormatWritesRows() {
    ResponseEntity<String> response = rest.postForEntity("/v1/ramps?format=csv",
        Map.of("table", areaTable()), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType().toString()).startsWith("text/csv");
    assertThat(response.getBody())
        .startsWith("area,timeId,netLoadRamp,balanceRamp,areaRamp")
        .contains("fr,2,-10.0,5.0,-5.0");
  }

  @Test
  void acceptHeaderSelectsCsv() {
    HttpHeaders headers = new HttpHeaders();
    headers.setAccept(List.of(MediaType.valueOf("text/csv")));
    ResponseEntity<String> response = rest.exchange("/v1/ramps", HttpMethod.POST,
        new HttpEntity<>(Map.of("areas", areaTable(), "districts", districtTable()), headers),
        String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).contains("district").contains("north");
  }

  @Test
  void invalidTimeStepIsRejected() {
    var response = post("?time_step=hourlyy", Map.of("table", areaTable()));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 1002)
        .containsEntry("parameter", "time_step")
        .containsKeys("error", "moreInfo", "path");
  }

  @Test
  void invalidFormatIsRejected() {
    var response = post("?format=xml", Map.of("table", areaTable()));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 1007);
  }

  @Test
  @SuppressWarnings("unchecked")
  void requestOptionsPlaceDailyBuckets() {
    var options = Map.of("simulation_name", "x", "start", "2030-06-01");

    var response = post("?time_step=daily", Map.of("table", areaTable(), "options", options));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    var table = (Map<String, Object>) response.getBody().get("table");
    assertThat(rows(table).get(0).get(2)).isEqualTo("2030-06-01");
  }

  @Test
  void requestOptionsWithoutStartDateAreRejected() {
    var response = post("?time_step=daily",
        Map.of("table", areaTable(), "options", Map.of("simulation_name", "x")));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getHeaders().getContentType().toString())
        .contains("application/problem+json");
    assertThat(response.getBody()).containsEntry("errorCode", 2005);
  }

  @Test
  void tableCannotBeCombinedWithContainer() {
    var response = post("", Map.of("table", areaTable(), "areas", areaTable()));
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }
}
