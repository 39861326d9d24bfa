package com.ospicorp.tsforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TsForecastApplication {

  public static void main(String[] args) {
    SpringApplication.run(TsForecastApplication.class, args);
  }
}
