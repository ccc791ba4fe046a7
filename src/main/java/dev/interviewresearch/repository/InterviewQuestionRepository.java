package dev.interviewresearch.repository;

import dev.interviewresearch.entity.InterviewQuestion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InterviewQuestionRepository extends JpaRepository<InterviewQuestion, String> {

    List<InterviewQuestion> findBySearchId(String searchId);

    long countBySearchId(String searchId);
}
