package com.example.scenegen_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ScenegenBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(ScenegenBackendApplication.class, args);
	}

}
