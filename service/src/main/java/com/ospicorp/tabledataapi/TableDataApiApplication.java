package com.ospicorp.tabledataapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

// No user store: the API is read-only and unauthenticated.
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class TableDataApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(TableDataApiApplication.class, args);
  }
}
