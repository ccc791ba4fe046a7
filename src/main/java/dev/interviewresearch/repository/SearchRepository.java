package dev.interviewresearch.repository;

import dev.interviewresearch.entity.Search;
import dev.interviewresearch.entity.SearchStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Repository for research jobs. Every progress write is one conditional update that only
 * matches rows not yet in a terminal state; callers read the returned row count.
 */
@Repository
public interface SearchRepository extends JpaRepository<Search, String> {

    /**
     * Move a job to processing at the given step. Sets startedAt on the first processing write.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Search s SET s.status = dev.interviewresearch.entity.SearchStatus.PROCESSING, "
            + "s.progressStep = :step, s.progressPercentage = :percentage, s.updatedAt = :now, "
            + "s.startedAt = COALESCE(s.startedAt, :now) "
            + "WHERE s.id = :id AND s.status NOT IN :terminal")
    int updateProgress(@Param("id") String id,
                       @Param("step") String step,
                       @Param("percentage") int percentage,
                       @Param("now") LocalDateTime now,
                       @Param("terminal") Collection<SearchStatus> terminal);

    /**
     * Final write of a successful run: completion plus the summary fields of the synthesis.
     * The priorities are written only when the conditional update matched.
     */
    @Transactional
    default int markCompletedWithSummary(String id, String step, LocalDateTime now, Double fitScore,
                                         List<String> priorities, Collection<SearchStatus> terminal) {
        int updated = markCompletedWithScore(id, step, now, fitScore, terminal);
        if (updated > 0) {
            findById(id).ifPresent(search -> {
                search.setPreparationPriorities(new ArrayList<>(priorities != null ? priorities : List.of()));
                save(search);
            });
        }
        return updated;
    }

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Search s SET s.status = dev.interviewresearch.entity.SearchStatus.COMPLETED, "
            + "s.progressStep = :step, s.progressPercentage = 100, s.updatedAt = :now, s.completedAt = :now, "
            + "s.overallFitScore = :fitScore "
            + "WHERE s.id = :id AND s.status NOT IN :terminal")
    int markCompletedWithScore(@Param("id") String id,
                               @Param("step") String step,
                               @Param("now") LocalDateTime now,
                               @Param("fitScore") Double fitScore,
                               @Param("terminal") Collection<SearchStatus> terminal);

    /**
     * Fail a job. The percentage is left where the job stopped.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Search s SET s.status = dev.interviewresearch.entity.SearchStatus.FAILED, "
            + "s.progressStep = COALESCE(:step, s.progressStep), s.errorMessage = :message, "
            + "s.updatedAt = :now, s.completedAt = :now "
            + "WHERE s.id = :id AND s.status NOT IN :terminal")
    int markFailed(@Param("id") String id,
                   @Param("message") String message,
                   @Param("step") String step,
                   @Param("now") LocalDateTime now,
                   @Param("terminal") Collection<SearchStatus> terminal);
}
