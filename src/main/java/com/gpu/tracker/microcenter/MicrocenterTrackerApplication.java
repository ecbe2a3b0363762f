package com.gpu.tracker.microcenter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MicrocenterTrackerApplication {

	public static void main(String[] args) {
		SpringApplication.run(MicrocenterTrackerApplication.class, args);
	}
}
