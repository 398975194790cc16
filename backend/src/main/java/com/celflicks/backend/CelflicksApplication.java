package com.celflicks.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CelflicksApplication {

	public static void main(String[] args) {
		// 로그와 감사 기록 시각을 UTC로 통일
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(CelflicksApplication.class, args);
	}

}
