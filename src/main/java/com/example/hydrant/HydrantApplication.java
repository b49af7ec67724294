package com.example.hydrant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HydrantApplication {

	public static void main(String[] args) {
		SpringApplication.run(HydrantApplication.class, args);
	}

}
