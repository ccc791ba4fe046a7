package dev.interviewresearch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "scraped_url_usages", indexes = {
        @Index(name = "idx_usages_search", columnList = "searchId"),
        @Index(name = "idx_usages_url", columnList = "scrapedUrlId")
})
public class ScrapedUrlUsage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String searchId;

    @Column(nullable = false)
    private String scrapedUrlId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UsageType usageType;

    private double qualityAtUse;

    @Column(nullable = false)
    private LocalDateTime usedAt;
}
