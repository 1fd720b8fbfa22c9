package com.botrank.botrank_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BotrankApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(BotrankApiApplication.class, args);
	}

}
