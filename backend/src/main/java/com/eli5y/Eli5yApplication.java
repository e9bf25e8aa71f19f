package com.eli5y;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Eli5y - semantic highlighter linking formula markup to a plain-language explanation.
 */
@SpringBootApplication
public class Eli5yApplication {

	public static void main(String[] args) {
		SpringApplication.run(Eli5yApplication.class, args);
	}

}
