package com.kvtrack.cache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class KvTrackApplication {

	public static void main(String[] args) {
		SpringApplication.run(KvTrackApplication.class, args);
	}

}
