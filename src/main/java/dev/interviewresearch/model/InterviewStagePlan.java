package dev.interviewresearch.model;

import java.util.List;

public record InterviewStagePlan(
        String name,
        int orderIndex,
        String duration,
        String interviewer,
        String content,
        String guidance,
        List<String> preparationTips,
        List<String> commonQuestions,
        List<String> redFlagsToAvoid) {
}
