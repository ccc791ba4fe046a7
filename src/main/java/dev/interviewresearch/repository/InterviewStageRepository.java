package dev.interviewresearch.repository;

import dev.interviewresearch.entity.InterviewStage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InterviewStageRepository extends JpaRepository<InterviewStage, String> {

    List<InterviewStage> findBySearchIdOrderByOrderIndexAsc(String searchId);
}
