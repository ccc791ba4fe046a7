package dev.interviewresearch.gather;

import com.fasterxml.jackson.databind.JsonNode;
import dev.interviewresearch.ai.CompletionClient;
import dev.interviewresearch.config.CompletionConfig;
import dev.interviewresearch.config.GatherConfig;
import dev.interviewresearch.model.GathererKey;
import dev.interviewresearch.model.ResearchRequest;
import dev.interviewresearch.support.JsonResponseParser;
import dev.interviewresearch.support.TextLimits;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Candidate profile from CV text. There is no URL involved, so the content cache is not used.
 */
@Component
public class CvProfileGatherer extends AbstractGatherer {

    private static final String SYSTEM_PROMPT = """
            You are an expert CV analyst. Extract a structured candidate profile from the CV text.
            Respond with a single JSON object only.
            """;

    private static final String OUTPUT_SCHEMA = """
            Return this JSON structure:
            {
              "current_role": "string",
              "experience_years": 0,
              "skills": {"technical": ["string"], "soft": ["string"], "certifications": ["string"]},
              "experience": [{"role": "string", "company": "string", "duration": "string", "achievements": ["string"]}],
              "education": [{"degree": "string", "institution": "string", "year": "string"}],
              "projects": [{"name": "string", "description": "string", "technologies": ["string"]}],
              "key_achievements": ["string"]
            }
            """;

    private final GatherConfig gatherConfig;

    public CvProfileGatherer(CompletionClient completionClient, CompletionConfig completionConfig,
                             JsonResponseParser jsonParser, GatherConfig gatherConfig) {
        super(completionClient, completionConfig, jsonParser);
        this.gatherConfig = gatherConfig;
    }

    @Override
    public GathererKey getKey() {
        return GathererKey.CV_ANALYSIS;
    }

    @Override
    protected Duration getTimeout() {
        return gatherConfig.getCvAnalysisTimeout();
    }

    @Override
    protected boolean appliesTo(ResearchRequest request) {
        return request.hasCv();
    }

    @Override
    protected Mono<JsonNode> doGather(ResearchRequest request, String searchId) {
        logPhase(searchId, "analysis", request.getCv().length() + " chars of CV text");
        String prompt = "CV text:\n" + TextLimits.truncate(request.getCv(), gatherConfig.getCvChars())
                + "\n\n" + OUTPUT_SCHEMA;
        return analyze("cv analysis", SYSTEM_PROMPT, prompt, completionConfig.getMaxTokens().getCvAnalysis())
                .doOnNext(result -> logPhase(searchId, "result", "candidate profile ready"));
    }
}
