package dev.interviewresearch.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.interviewresearch.config.SynthesisConfig;
import dev.interviewresearch.model.GatheredResearch;
import dev.interviewresearch.model.ResearchRequest;
import dev.interviewresearch.support.TextLimits;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the prompts of the consolidated synthesis call.
 */
@Component
@RequiredArgsConstructor
public class SynthesisPromptBuilder {

    static final String SYSTEM_PROMPT = """
            You are an expert interview preparation consultant with deep knowledge of hiring practices
            across major companies and technical roles.

            Create a tailored interview preparation guide from the company research, job requirements
            and candidate profile provided:
            1. Four realistic interview stages based on the company's actual hiring process.
            2. A CV-to-job comparison with skill gaps and experience mapping.
            3. 30 to 50 tailored interview questions across the categories of the schema, 5 to 8 per category.
            4. Personalized preparation guidance.

            Every question must reference specific details of the company, the job or the candidate.
            Ground everything in the research provided. Respond with a single JSON object only.
            """;

    private static final String OUTPUT_SCHEMA = """
            Return this exact JSON structure:
            {
              "interview_stages": [
                {"name": "Stage Name", "order_index": 1, "duration": "Duration estimate", "interviewer": "Who conducts",
                 "content": "What to expect", "guidance": "How to approach", "preparation_tips": ["tip"],
                 "common_questions": ["question"], "red_flags_to_avoid": ["flag"]}
              ],
              "comparison_analysis": {
                "skill_gap_analysis": {
                  "matching_skills": {"technical": ["skill"], "soft": ["skill"], "certifications": ["cert"]},
                  "missing_skills": {"technical": ["skill"], "soft": ["skill"]},
                  "skill_match_percentage": {"technical": 0, "soft": 0, "overall": 0}
                },
                "experience_gap_analysis": {
                  "relevant_experience": [{"experience": "string", "relevance_score": 0.8, "how_to_highlight": "string"}],
                  "missing_experience": [{"requirement": "string", "severity": "low|medium|high", "mitigation_strategy": "string"}]
                },
                "personalized_story_bank": {
                  "stories": [{"situation": "S", "task": "T", "action": "A", "result": "R", "applicable_questions": [], "impact_quantified": "string"}]
                },
                "interview_prep_strategy": {
                  "strengths_to_emphasize": ["string"], "weaknesses_to_address": ["string"],
                  "competitive_positioning": {"unique_value_proposition": "string", "differentiation_points": []}
                },
                "overall_fit_score": 0
              },
              "interview_questions_data": {
                "behavioral": [
                  {"question": "Specific question", "category": "behavioral", "difficulty": "easy|medium|hard",
                   "rationale": "Why it is asked", "suggested_answer_approach": "How to answer",
                   "evaluation_criteria": ["criterion"], "follow_up_questions": ["question"],
                   "star_story_fit": true, "company_context": "How it relates to the company", "confidence_score": 0.9}
                ],
                "technical": [], "situational": [], "company_specific": [],
                "role_specific": [], "experience_based": [], "cultural_fit": []
              },
              "preparation_guidance": {
                "preparation_timeline": {"weeks_before": ["task"], "week_before": ["task"], "day_before": ["task"], "day_of": ["task"]},
                "preparation_priorities": ["priority"],
                "personalized_guidance": {"strengths_to_highlight": ["string"], "areas_to_improve": ["string"], "suggested_stories": ["string"]}
              }
            }
            """;

    private final SynthesisConfig synthesisConfig;
    private final ObjectMapper objectMapper;

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String userPrompt(ResearchRequest request, GatheredResearch gathered) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("=== SUBJECT ===\n")
                .append("Company: ").append(request.getCompany()).append('\n')
                .append("Role: ").append(orDefault(request.getRole(), "Not specified")).append('\n')
                .append("Country: ").append(orDefault(request.getCountry(), "Not specified")).append('\n')
                .append("Target seniority: ").append(orDefault(request.getTargetSeniority(), "mid")).append("\n\n");

        appendSource(prompt, "COMPANY RESEARCH", gathered.companyResearch(), synthesisConfig.getCompanyChars());
        appendSource(prompt, "JOB REQUIREMENTS", gathered.jobRequirements(), synthesisConfig.getJobChars());
        appendSource(prompt, "CANDIDATE PROFILE", gathered.cvAnalysis(), synthesisConfig.getCvChars());

        if (gathered.availableSources() == 0) {
            prompt.append("No research sources are available. Base the guide on the subject above ")
                    .append("and state clearly that it is generic.\n\n");
        }
        if (gathered.cvAnalysis() == null) {
            prompt.append("No candidate profile is available: leave the comparison analysis sparse ")
                    .append("and set overall_fit_score to 0.\n\n");
        }

        prompt.append("Match question complexity to a ")
                .append(orDefault(request.getTargetSeniority(), "mid"))
                .append("-level candidate.\n\n")
                .append(OUTPUT_SCHEMA);
        return prompt.toString();
    }

    private void appendSource(StringBuilder prompt, String title, JsonNode source, int budget) {
        if (source == null || source.isNull()) {
            return;
        }
        prompt.append("=== ").append(title).append(" ===\n")
                .append(TextLimits.truncate(pretty(source), budget))
                .append("\n\n");
    }

    private String pretty(JsonNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return node.toString();
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
