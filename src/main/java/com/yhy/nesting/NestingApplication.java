package com.yhy.nesting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NestingApplication {

	public static void main(String[] args) {
		SpringApplication.run(NestingApplication.class, args);
	}

}
