package com.flamingo.ai.papersplit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot application wiring the paper analysis and splitting services. */
@SpringBootApplication
public class PaperSplitApplication {

  public static void main(String[] args) {
    SpringApplication.run(PaperSplitApplication.class, args);
  }
}
