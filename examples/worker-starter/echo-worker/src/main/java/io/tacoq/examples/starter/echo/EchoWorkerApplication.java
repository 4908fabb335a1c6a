package io.tacoq.examples.starter.echo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Minimal Spring Boot entrypoint showing how to run a TacoQ worker with two task kinds.
 */
@SpringBootApplication
public class EchoWorkerApplication {

  public static void main(String[] args) {
    SpringApplication.run(EchoWorkerApplication.class, args);
  }
}
