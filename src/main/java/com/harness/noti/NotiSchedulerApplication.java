package com.harness.noti;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NotiSchedulerApplication {
  public static void main(String[] args) {
    SpringApplication.run(NotiSchedulerApplication.class, args);
  }
}
