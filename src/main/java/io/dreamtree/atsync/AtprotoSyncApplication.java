package io.dreamtree.atsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AtprotoSyncApplication {
  public static void main(String[] args) {
    SpringApplication.run(AtprotoSyncApplication.class, args);
  }
}
