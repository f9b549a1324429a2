package com.foodgram.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

@SpringBootApplication
@EnableJpaAuditing
public class FoodgramApplication {

	public static void main(String[] args) {
		SpringApplication.run(FoodgramApplication.class, args);
	}

}
