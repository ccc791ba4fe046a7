package dev.interviewresearch.repository;

import dev.interviewresearch.entity.ScrapedUrl;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the content reuse cache.
 */
@Repository
public interface ScrapedUrlRepository extends JpaRepository<ScrapedUrl, String> {

    /**
     * Candidates for reuse, best first. Age and role/country matching are applied by the caller.
     */
    @Query("SELECT u FROM ScrapedUrl u WHERE LOWER(u.companyName) = LOWER(:company) "
            + "AND u.qualityScore >= :minQuality "
            + "ORDER BY u.qualityScore DESC, u.timesReused DESC")
    List<ScrapedUrl> findCandidates(@Param("company") String company,
                                    @Param("minQuality") double minQuality);

    @Query("SELECT u FROM ScrapedUrl u WHERE LOWER(u.companyName) = LOWER(:company) AND u.url IN :urls")
    List<ScrapedUrl> findByCompanyAndUrls(@Param("company") String company,
                                          @Param("urls") Collection<String> urls);

    Optional<ScrapedUrl> findByUrlHashAndCompanyName(String urlHash, String companyName);

    /**
     * Atomic reuse counter increment.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE ScrapedUrl u SET u.timesReused = u.timesReused + 1, u.lastReusedAt = :now "
            + "WHERE u.id = :id")
    int incrementReuse(@Param("id") String id, @Param("now") LocalDateTime now);
}
