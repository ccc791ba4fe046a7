package dev.interviewresearch.synthesis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.interviewresearch.config.SynthesisConfig;
import dev.interviewresearch.model.GatheredResearch;
import dev.interviewresearch.model.ResearchRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SynthesisPromptBuilderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SynthesisConfig config;
    private SynthesisPromptBuilder builder;

    @BeforeEach
    void setUp() {
        config = new SynthesisConfig();
        builder = new SynthesisPromptBuilder(config, objectMapper);
    }

    @Test
    @DisplayName("Should include every available source and the subject")
    void shouldIncludeSources() {
        ObjectNode company = objectMapper.createObjectNode().put("industry", "Aerospace");
        ObjectNode cv = objectMapper.createObjectNode().put("current_role", "Backend Engineer");
        ResearchRequest request = ResearchRequest.builder()
                .company("Acme").role("Engineer").country("Germany").targetSeniority("senior").build();

        String prompt = builder.userPrompt(request, new GatheredResearch(company, null, cv));

        assertThat(prompt)
                .contains("=== SUBJECT ===")
                .contains("Country: Germany")
                .contains("=== COMPANY RESEARCH ===")
                .contains("Aerospace")
                .contains("=== CANDIDATE PROFILE ===")
                .contains("senior-level candidate")
                .doesNotContain("=== JOB REQUIREMENTS ===")
                .doesNotContain("No candidate profile is available");
    }

    @Test
    @DisplayName("Should note a missing candidate profile")
    void shouldNoteMissingCv() {
        ObjectNode company = objectMapper.createObjectNode().put("industry", "Aerospace");

        String prompt = builder.userPrompt(ResearchRequest.builder().company("Acme").build(),
                new GatheredResearch(company, null, null));

        assertThat(prompt)
                .contains("No candidate profile is available")
                .contains("Role: Not specified")
                .contains("mid-level candidate");
    }

    @Test
    @DisplayName("Should truncate each source to its budget")
    void shouldTruncateSources() {
        config.setCompanyChars(50);
        ObjectNode company = objectMapper.createObjectNode().put("notes", "x".repeat(500) + "END");

        String prompt = builder.userPrompt(ResearchRequest.builder().company("Acme").build(),
                new GatheredResearch(company, null, null));

        assertThat(prompt).doesNotContain("END\"");
    }
}
