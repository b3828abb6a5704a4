package io.intellixity.querywall.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class QueryWallApplication {
  public static void main(String[] args) {
    SpringApplication.run(QueryWallApplication.class, args);
  }
}
