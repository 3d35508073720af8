package com.ospicorp.tabledataapi.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class RequestDescriptionsTest {

  @Test
  void appendsQueryStringWhenPresent() {
    var request = new MockHttpServletRequest("GET", "/v1/data");
    request.setQueryString("table=sensor1&date=2024-01-01");

    assertEquals("/v1/data?table=sensor1&date=2024-01-01", RequestDescriptions.uriWithQuery(request));
  }

  @Test
  void omitsEmptyQueryString() {
    var request = new MockHttpServletRequest("GET", "/v1/tables");

    assertEquals("/v1/tables", RequestDescriptions.uriWithQuery(request));
  }

  @Test
  void prefersFirstForwardedAddress() {
    var request = new MockHttpServletRequest("GET", "/v1/data");
    request.setRemoteAddr("10.0.0.5");
    request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");

    assertEquals("203.0.113.7", RequestDescriptions.clientIp(request));
  }

  @Test
  void fallsBackToRemoteAddress() {
    var request = new MockHttpServletRequest("GET", "/v1/data");
    request.setRemoteAddr("10.0.0.5");

    assertEquals("10.0.0.5", RequestDescriptions.clientIp(request));
  }
}
