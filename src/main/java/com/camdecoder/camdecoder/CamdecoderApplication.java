package com.camdecoder.camdecoder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CamdecoderApplication {

	public static void main(String[] args) {
		SpringApplication.run(CamdecoderApplication.class, args);
	}

}
