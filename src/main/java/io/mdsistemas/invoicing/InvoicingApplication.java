package io.mdsistemas.invoicing;

import java.time.Clock;
import java.util.Properties;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import lombok.extern.slf4j.Slf4j;

@SpringBootApplication
@OpenAPIDefinition(info = @Info(title = "MD Sistemas Invoicing Api", version = "1.0", description = "Billing spreadsheet to invoice documents"))
@Slf4j
public class InvoicingApplication {

	@Value("${invoicing.cors.allowed-origins:http://localhost:5173}")
	private String[] allowedOrigins;

	public static void main(String[] args) {
		SpringApplication.run(InvoicingApplication.class, args);
		log.info("... Application started Successfully ...");
	}

	@Bean
	public BuildProperties buildProperties() {
		return new BuildProperties(new Properties());
	}

	@Bean
	public Clock clock() {
		return Clock.systemDefaultZone();
	}

	@Bean
	public WebMvcConfigurer corsConfigurer() {
		return new WebMvcConfigurer() {
			@Override
			public void addCorsMappings(CorsRegistry registry) {
				registry.addMapping("/api/**")
				.allowedOrigins(allowedOrigins)
				.allowedMethods("GET", "POST", "PUT", "OPTIONS")
				.allowedHeaders("*");
			}
		};
	}
}
