package dev.interviewresearch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One research job. Progress columns are only written through the conditional updates
 * in {@link dev.interviewresearch.repository.SearchRepository}.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "searches", indexes = {
        @Index(name = "idx_searches_user", columnList = "userId"),
        @Index(name = "idx_searches_status", columnList = "status")
})
public class Search {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    private String userId;

    @Column(nullable = false)
    private String company;

    private String role;

    private String country;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> roleLinks = new ArrayList<>();

    @Column(length = 20)
    private String targetSeniority;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SearchStatus status = SearchStatus.PENDING;

    private String progressStep;

    @Builder.Default
    @Column(nullable = false)
    private int progressPercentage = 0;

    @Column(length = 2000)
    private String errorMessage;

    private Double overallFitScore;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> preparationPriorities = new ArrayList<>();

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private LocalDateTime updatedAt;
}
