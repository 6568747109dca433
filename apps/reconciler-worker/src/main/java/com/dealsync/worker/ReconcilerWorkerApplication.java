package com.dealsync.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReconcilerWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(ReconcilerWorkerApplication.class, args);
  }
}
