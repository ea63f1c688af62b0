package com.github.adamzv.kafkatobwhc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KafkaToBwhcApplication {

  public static void main(String[] args) {
    SpringApplication.run(KafkaToBwhcApplication.class, args);
  }
}
