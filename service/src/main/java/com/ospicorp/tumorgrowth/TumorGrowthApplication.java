package com.ospicorp.tumorgrowth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TumorGrowthApplication {

  public static void main(String[] args) {
    SpringApplication.run(TumorGrowthApplication.class, args);
  }
}
