package com.example.voiceprint_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class VoiceprintBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(VoiceprintBackendApplication.class, args);
	}

}
