package com.yourapp.chatshell;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatShellApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(ChatShellApplication.class, args)));
  }
}
