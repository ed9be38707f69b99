package com.nestwatch.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NestWatchBackendApplication {

  public static void main(String[] args) {
    SpringApplication.run(NestWatchBackendApplication.class, args);
  }
}
