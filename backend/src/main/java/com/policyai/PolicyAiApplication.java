package com.policyai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PolicyAi - guarded policy-suggestion service for care-home policy authoring.
 */
@SpringBootApplication
public class PolicyAiApplication {

	public static void main(String[] args) {
		SpringApplication.run(PolicyAiApplication.class, args);
	}

}
