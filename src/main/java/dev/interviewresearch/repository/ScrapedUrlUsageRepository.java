package dev.interviewresearch.repository;

import dev.interviewresearch.entity.ScrapedUrlUsage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScrapedUrlUsageRepository extends JpaRepository<ScrapedUrlUsage, String> {

    List<ScrapedUrlUsage> findBySearchId(String searchId);
}
