package com.livehub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiveHubApplication {

	public static void main(String[] args) {
		SpringApplication.run(LiveHubApplication.class, args);
	}
}
