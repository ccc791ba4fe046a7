package dev.interviewresearch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A previously fetched document, shared across searches for the same company.
 * Entries are never deleted; staleness is derived from {@code firstScrapedAt}.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "scraped_urls", uniqueConstraints = {
        @UniqueConstraint(name = "uk_scraped_urls_hash_company", columnNames = {"urlHash", "companyName"})
}, indexes = {
        @Index(name = "idx_scraped_urls_company", columnList = "companyName"),
        @Index(name = "idx_scraped_urls_quality", columnList = "qualityScore")
})
public class ScrapedUrl {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 2048)
    private String url;

    @Column(nullable = false, length = 64)
    private String urlHash;

    private String domain;

    @Column(length = 1000)
    private String title;

    @Column(length = 1000)
    private String contentSummary;

    @Column(columnDefinition = "TEXT")
    private String fullContent;

    @Column(length = 40)
    private String contentType;

    @Column(nullable = false)
    private String companyName;

    private String roleTitle;

    private String country;

    @Column(nullable = false)
    private double qualityScore;

    @Builder.Default
    @Column(nullable = false)
    private int timesReused = 0;

    @Column(nullable = false)
    private LocalDateTime firstScrapedAt;

    private LocalDateTime lastReusedAt;

    private LocalDateTime updatedAt;
}
