package dev.jobalerts.repository;

import dev.jobalerts.entity.PostingRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for persisted postings.
 */
@Repository
public interface PostingRepository extends JpaRepository<PostingRecord, Long> {

    boolean existsByUrl(String url);

    /**
     * Postings still waiting for a successful delivery, oldest first.
     */
    List<PostingRecord> findByNotifiedFalseOrderByIdAsc();

    long countByNotifiedFalse();

    /**
     * Flip the notified flag. Matches nothing when the URL is unknown or
     * already notified.
     *
     * @return number of rows changed (0 or 1)
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE PostingRecord p SET p.notified = true WHERE p.url = :url AND p.notified = false")
    int markNotified(String url);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM PostingRecord p WHERE p.firstSeen < :cutoff")
    int deleteSeenBefore(LocalDateTime cutoff);
}
