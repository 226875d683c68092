package com.eduhub.learning_backend;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication(scanBasePackages = "com.eduhub.learning_backend")
@MapperScan("com.eduhub.learning_backend.modules.*.mapper")
@EnableCaching
public class LearningBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(LearningBackendApplication.class, args);
	}

}
