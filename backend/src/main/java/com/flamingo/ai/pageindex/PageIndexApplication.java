package com.flamingo.ai.pageindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the document index service. */
@SpringBootApplication
public class PageIndexApplication {

  public static void main(String[] args) {
    SpringApplication.run(PageIndexApplication.class, args);
  }
}
