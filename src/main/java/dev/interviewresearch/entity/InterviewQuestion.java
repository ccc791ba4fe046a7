package dev.interviewresearch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "interview_questions", indexes = {
        @Index(name = "idx_questions_search", columnList = "searchId"),
        @Index(name = "idx_questions_stage", columnList = "stageId")
})
public class InterviewQuestion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String searchId;

    @Column(nullable = false)
    private String stageId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String question;

    private String category;

    @Builder.Default
    private String questionType = "synthesized";

    @Builder.Default
    @Column(length = 10)
    private String difficulty = "Medium";

    @Column(columnDefinition = "TEXT")
    private String rationale;

    @Column(columnDefinition = "TEXT")
    private String suggestedAnswerApproach;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> evaluationCriteria = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> followUpQuestions = new ArrayList<>();

    @Builder.Default
    private boolean starStoryFit = false;

    @Column(columnDefinition = "TEXT")
    private String companyContext;

    @Builder.Default
    private double confidenceScore = 0.8;

    private LocalDateTime createdAt;
}
