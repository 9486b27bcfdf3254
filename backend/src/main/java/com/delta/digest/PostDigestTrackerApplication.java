package com.delta.digest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PostDigestTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(PostDigestTrackerApplication.class, args);
  }
}
