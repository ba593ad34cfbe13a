package com.example.prospectus;

import com.example.prospectus.application.service.InsightAssembler;
import com.example.prospectus.config.InsightProperties;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ProspectusInsightApplicationTests {

	@Autowired
	private InsightAssembler insightAssembler;

	@Autowired
	private InsightProperties properties;

	@Test
	void contextLoads() {
		assertThat(insightAssembler).isNotNull();
		assertThat(properties.getSummary().getSentenceCount()).isPositive();
	}

}
