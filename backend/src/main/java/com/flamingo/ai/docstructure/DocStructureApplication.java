package com.flamingo.ai.docstructure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocStructureApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocStructureApplication.class, args);
  }
}
