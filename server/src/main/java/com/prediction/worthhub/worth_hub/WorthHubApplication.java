package com.prediction.worthhub.worth_hub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WorthHubApplication {

	public static void main(String[] args) {
		SpringApplication.run(WorthHubApplication.class, args);
	}

}
