package dev.interviewresearch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Subject attributes submitted for one research job. Only {@code company} is required.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchRequest {
    private String company;
    private String role;
    private String country;

    @Builder.Default
    private List<String> roleLinks = new ArrayList<>();

    private String cv;              // Raw CV text, never persisted on the search row
    private String targetSeniority; // junior, mid or senior
    private String userId;

    public boolean hasRoleLinks() {
        return roleLinks != null && roleLinks.stream().anyMatch(link -> link != null && !link.isBlank());
    }

    public boolean hasCv() {
        return cv != null && !cv.isBlank();
    }
}
