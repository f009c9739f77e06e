package com.flamingo.ai.coursegate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the courseware quality-gate service. */
@SpringBootApplication
public class CoursegateApplication {

  public static void main(String[] args) {
    SpringApplication.run(CoursegateApplication.class, args);
  }
}
