package com.ukboards;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class UkBoardsApplication {

  public static void main(String[] args) {
    SpringApplication.run(UkBoardsApplication.class, args);
  }
}
