package com.taodividends.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TaoDividendsApplication {
	public static void main(String[] args) {
		SpringApplication.run(TaoDividendsApplication.class, args);
	}
}
