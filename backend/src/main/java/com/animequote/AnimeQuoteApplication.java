package com.animequote;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Anime Quote Analyzer - subtitle ingestion and Japanese sentence annotation.
 */
@SpringBootApplication
public class AnimeQuoteApplication {

	public static void main(String[] args) {
		SpringApplication.run(AnimeQuoteApplication.class, args);
	}

}
