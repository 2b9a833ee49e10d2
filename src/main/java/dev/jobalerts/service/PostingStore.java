package dev.jobalerts.service;

import dev.jobalerts.entity.PostingRecord;
import dev.jobalerts.model.Posting;
import dev.jobalerts.repository.PostingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Persistent set of seen postings keyed by URL, with a notified flag per entry.
 * <p>
 * Each operation runs in its own transaction. URL uniqueness is enforced by the
 * database, so concurrent inserts of the same URL cannot produce two rows.
 * Failures other than a uniqueness conflict mean the store is unavailable and
 * are propagated to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostingStore {

    static final int MAX_DESCRIPTION_LENGTH = 4000;

    private final PostingRepository postingRepository;

    /**
     * Check whether a posting with this URL has been persisted.
     */
    public boolean exists(String url) {
        return postingRepository.existsByUrl(url);
    }

    /**
     * Persist a posting unless its URL is already known.
     *
     * @param posting The posting to insert
     * @return true if a new row was written, false if the URL already existed
     */
    public boolean add(Posting posting) {
        if (postingRepository.existsByUrl(posting.getUrl())) {
            log.debug("Posting already known: {}", posting.getUrl());
            return false;
        }

        try {
            postingRepository.saveAndFlush(toRecord(posting));
            log.info("Stored new posting: {} at {}", posting.getTitle(), posting.getCompany());
            return true;
        } catch (DataIntegrityViolationException e) {
            // Another producer inserted the same URL between the check and the insert
            log.debug("Posting already known (concurrent insert): {}", posting.getUrl());
            return false;
        } catch (DataAccessException e) {
            // Some drivers report the unique violation without a constraint error code
            if (postingRepository.existsByUrl(posting.getUrl())) {
                log.debug("Posting already known after failed insert: {}", posting.getUrl());
                return false;
            }
            throw e;
        }
    }

    /**
     * Mark a posting as notified. Unknown or already-notified URLs are ignored.
     */
    public void markNotified(String url) {
        int updated = postingRepository.markNotified(url);
        if (updated > 0) {
            log.debug("Marked posting as notified: {}", url);
        }
    }

    /**
     * All persisted postings whose notified flag is still false, in insertion order.
     */
    public List<Posting> unnotified() {
        return postingRepository.findByNotifiedFalseOrderByIdAsc().stream()
                .map(this::toPosting)
                .toList();
    }

    /**
     * Total number of persisted postings.
     */
    public long count() {
        return postingRepository.count();
    }

    /**
     * Number of persisted postings still waiting for a successful delivery.
     */
    public long countUnnotified() {
        return postingRepository.countByNotifiedFalse();
    }

    /**
     * Remove postings first seen more than {@code daysToKeep} days ago.
     *
     * @return number of rows removed
     */
    public int deleteOlderThan(int daysToKeep) {
        LocalDateTime cutoff = LocalDateTime.now().minusDays(daysToKeep);
        int removed = postingRepository.deleteSeenBefore(cutoff);
        log.info("Removed {} postings first seen more than {} days ago", removed, daysToKeep);
        return removed;
    }

    private PostingRecord toRecord(Posting posting) {
        Instant firstSeen = posting.getFirstSeen() != null ? posting.getFirstSeen() : Instant.now();
        return PostingRecord.builder()
                .company(nullToEmpty(posting.getCompany()))
                .title(nullToEmpty(posting.getTitle()))
                .url(posting.getUrl())
                .location(nullToEmpty(posting.getLocation()))
                .jobType(nullToEmpty(posting.getJobType()))
                .description(truncate(nullToEmpty(posting.getDescription())))
                .firstSeen(LocalDateTime.ofInstant(firstSeen, ZoneId.systemDefault()))
                .notified(false)
                .build();
    }

    private Posting toPosting(PostingRecord rec) {
        return Posting.builder()
                .company(rec.getCompany())
                .title(rec.getTitle())
                .url(rec.getUrl())
                .location(nullToEmpty(rec.getLocation()))
                .jobType(nullToEmpty(rec.getJobType()))
                .description(nullToEmpty(rec.getDescription()))
                .firstSeen(rec.getFirstSeen().atZone(ZoneId.systemDefault()).toInstant())
                .notified(rec.isNotified())
                .build();
    }

    private static String truncate(String text) {
        return text.length() > MAX_DESCRIPTION_LENGTH ? text.substring(0, MAX_DESCRIPTION_LENGTH) : text;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
