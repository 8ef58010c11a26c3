package com.example.autoslides_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AutoslidesBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(AutoslidesBackendApplication.class, args);
	}

}
