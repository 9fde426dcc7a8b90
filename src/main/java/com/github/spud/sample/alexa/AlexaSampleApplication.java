package com.github.spud.sample.alexa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlexaSampleApplication {

  public static void main(String[] args) {
    SpringApplication.run(AlexaSampleApplication.class, args);
  }

}
