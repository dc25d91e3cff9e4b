package com.ospicorp.netloadramp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NetLoadRampApplication {

  public static void main(String[] args) {
    SpringApplication.run(NetLoadRampApplication.class, args);
  }
}
