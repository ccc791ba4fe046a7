package dev.interviewresearch.controller;

import dev.interviewresearch.model.ProgressView;
import dev.interviewresearch.model.ResearchRequest;
import dev.interviewresearch.model.ResearchResults;
import dev.interviewresearch.service.ResearchJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * REST controller for research jobs: submit, poll progress, read results.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/searches")
@RequiredArgsConstructor
public class ResearchController {

    private final ResearchJobService researchJobService;

    /**
     * Start a research job. Returns immediately; the run continues in the background.
     */
    @PostMapping
    public Mono<ResponseEntity<Map<String, Object>>> startSearch(@RequestBody ResearchRequest request) {
        log.info("Starting research job: company='{}', role='{}', userId={}",
                request.getCompany(), request.getRole(), request.getUserId());

        if (request.getCompany() == null || request.getCompany().isBlank()) {
            return Mono.just(ResponseEntity.badRequest().body(Map.of(
                    "error", "Company is required"
            )));
        }

        return researchJobService.startJob(request)
                .map(searchId -> ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.<String, Object>of(
                        "searchId", searchId,
                        "status", "pending"
                )));
    }

    @GetMapping("/{searchId}/progress")
    public Mono<ResponseEntity<ProgressView>> getProgress(@PathVariable String searchId) {
        return researchJobService.getProgress(searchId)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{searchId}/results")
    public Mono<ResponseEntity<ResearchResults>> getResults(@PathVariable String searchId) {
        return researchJobService.getResults(searchId)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
