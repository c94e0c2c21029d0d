package com.aiadvent.chatcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatCoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChatCoreApplication.class, args);
  }
}
