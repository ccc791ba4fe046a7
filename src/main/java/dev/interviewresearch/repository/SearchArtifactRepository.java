package dev.interviewresearch.repository;

import dev.interviewresearch.entity.SearchArtifact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SearchArtifactRepository extends JpaRepository<SearchArtifact, String> {

    Optional<SearchArtifact> findBySearchId(String searchId);
}
