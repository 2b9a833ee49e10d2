package dev.jobalerts.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persisted posting. One row per distinct URL; the unique constraint on
 * {@code url} is what guarantees deduplication across concurrent inserts.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "postings", indexes = {
        @Index(name = "idx_postings_url", columnList = "url"),
        @Index(name = "idx_postings_notified", columnList = "notified")
})
public class PostingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String company;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, unique = true, length = 2048)
    private String url;

    @Column(length = 500)
    private String location;

    @Column(name = "job_type")
    private String jobType;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "first_seen", nullable = false)
    private LocalDateTime firstSeen;

    @Column(nullable = false)
    private boolean notified;
}
