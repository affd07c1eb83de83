package com.example.techpack;

import com.example.techpack.domain.model.Relevance;
import com.example.techpack.domain.model.TechPackVocabulary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest
@AutoConfigureMockMvc
class TechPackApplicationTests {

	@Autowired
	private MockMvc mockMvc;

	@Autowired
	private TechPackVocabulary vocabulary;

	/**
	 * Ensures the application context loads and the default vocabulary is in place.
	 */
	@Test
	void contextLoads() {
		assertThat(vocabulary.relevanceTerms()).containsEntry("margin", Relevance.GAUGE);
		assertThat(vocabulary.isIgnoredLine("Buyer: ACME")).isTrue();
	}

	@Test
	void healthReportsConfiguredVersion() throws Exception {
		mockMvc.perform(get("/health"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.status").value("OK"))
				.andExpect(jsonPath("$.service").value("Tech Pack Parser"))
				.andExpect(jsonPath("$.version").value("1.0.0"));
	}
}
