package com.yunhwan.error.advice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ErrorAdviceApplication {

	public static void main(String[] args) {
		SpringApplication.run(ErrorAdviceApplication.class, args);
	}

}
