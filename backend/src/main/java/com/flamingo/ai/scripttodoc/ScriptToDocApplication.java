package com.flamingo.ai.scripttodoc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the transcript-to-training-steps pipeline. */
@SpringBootApplication
public class ScriptToDocApplication {

  public static void main(String[] args) {
    SpringApplication.run(ScriptToDocApplication.class, args);
  }
}
