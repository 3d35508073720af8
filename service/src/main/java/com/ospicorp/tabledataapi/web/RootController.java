package com.ospicorp.tabledataapi.web;

import io.swagger.v3.oas.annotations.Hidden;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Hidden
public class RootController {
  private static final List<String> ENDPOINTS = List.of(
      "/v1/data?table={table}&date={date}&function={function}",
      "/v1/data/range?table={table}&start={start}&end={end}",
      "/v1/tables",
      "/v1/tables/{table}/summary",
      "/v1/tables/{table}/points?index={index}&date={date}&time={time}&value={value}");

  private final String serviceName;

  public RootController(@Value("${spring.application.name:tabledata-service}") String serviceName) {
    this.serviceName = serviceName;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", serviceName);
    body.put("status", "ok");
    body.put("endpoints", ENDPOINTS);
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
