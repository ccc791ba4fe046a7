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
@Table(name = "interview_stages", indexes = {
        @Index(name = "idx_stages_search", columnList = "searchId")
})
public class InterviewStage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String searchId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private int orderIndex;

    private String duration;

    private String interviewer;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(columnDefinition = "TEXT")
    private String guidance;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> preparationTips = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> commonQuestions = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> redFlagsToAvoid = new ArrayList<>();

    private LocalDateTime createdAt;
}
