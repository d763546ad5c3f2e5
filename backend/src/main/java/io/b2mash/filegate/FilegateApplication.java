package io.b2mash.filegate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FilegateApplication {

  public static void main(String[] args) {
    SpringApplication.run(FilegateApplication.class, args);
  }
}
