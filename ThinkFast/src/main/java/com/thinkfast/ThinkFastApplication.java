package com.thinkfast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThinkFastApplication {

  public static void main(String[] args) {
    SpringApplication.run(ThinkFastApplication.class, args);
  }
}
