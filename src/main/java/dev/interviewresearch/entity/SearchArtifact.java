package dev.interviewresearch.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Raw gatherer output and synthesis output of one search, one row per search.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "search_artifacts", uniqueConstraints = {
        @UniqueConstraint(name = "uk_search_artifacts_search", columnNames = "searchId")
})
public class SearchArtifact {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String searchId;

    private String userId;

    @Convert(converter = JsonNodeConverter.class)
    @Column(columnDefinition = "TEXT")
    private JsonNode companyResearchRaw;

    @Convert(converter = JsonNodeConverter.class)
    @Column(columnDefinition = "TEXT")
    private JsonNode jobAnalysisRaw;

    @Convert(converter = JsonNodeConverter.class)
    @Column(columnDefinition = "TEXT")
    private JsonNode cvAnalysisRaw;

    @Convert(converter = JsonNodeConverter.class)
    @Column(columnDefinition = "TEXT")
    private JsonNode synthesisMetadata;

    @Convert(converter = JsonNodeConverter.class)
    @Column(columnDefinition = "TEXT")
    private JsonNode comparisonAnalysis;

    @Convert(converter = JsonNodeConverter.class)
    @Column(columnDefinition = "TEXT")
    private JsonNode interviewStages;

    @Convert(converter = JsonNodeConverter.class)
    @Column(columnDefinition = "TEXT")
    private JsonNode interviewQuestionsData;

    @Convert(converter = JsonNodeConverter.class)
    @Column(columnDefinition = "TEXT")
    private JsonNode preparationGuidance;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private ArtifactStatus processingStatus;

    private LocalDateTime processingStartedAt;

    private LocalDateTime processingRawSaveAt;

    private LocalDateTime processingSynthesisEndAt;

    private LocalDateTime processingCompletedAt;

    private LocalDateTime updatedAt;
}
