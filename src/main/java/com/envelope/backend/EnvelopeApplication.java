package com.envelope.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import com.envelope.backend.config.DotenvLoader;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EnvelopeApplication {

	public static void main(String[] args) {
		DotenvLoader.loadFromWorkingDirectoryIfPresent();
		SpringApplication.run(EnvelopeApplication.class, args);
	}

}
