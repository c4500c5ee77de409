package com.survey.boothsampling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.util.StringUtils;

import java.util.Map;

@SpringBootApplication
@EnableAspectJAutoProxy
@EnableCaching
public class BoothSamplingApplication {

	private static final String DEFAULT_PROFILE = "dev";

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(BoothSamplingApplication.class);

		// Local layer folder and debug logging unless a profile is chosen
		if (!StringUtils.hasText(System.getenv("SPRING_PROFILES_ACTIVE"))) {
			app.setDefaultProperties(Map.of("spring.profiles.active", DEFAULT_PROFILE));
		}

		app.run(args);
	}
}
