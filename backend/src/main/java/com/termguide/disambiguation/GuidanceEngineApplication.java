package com.termguide.disambiguation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GuidanceEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(GuidanceEngineApplication.class, args);
  }
}
