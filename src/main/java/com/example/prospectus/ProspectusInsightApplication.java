package com.example.prospectus;

import com.example.prospectus.config.InsightProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Application entry point. Wires the insight pipeline and exposes the HTTP endpoints defined under the
 * interfaces layer.
 */
@SpringBootApplication
@EnableConfigurationProperties(InsightProperties.class)
public class ProspectusInsightApplication {

	public static void main(String[] args) {
		SpringApplication.run(ProspectusInsightApplication.class, args);
	}

}
