package dev.etfaggregator.entity;

import dev.etfaggregator.model.RunOutcome;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One finished source update, kept as run history.
 * Times are UTC.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "update_runs", indexes = {
        @Index(name = "idx_update_runs_collection", columnList = "collection"),
        @Index(name = "idx_update_runs_finished_at", columnList = "finishedAt")
})
public class UpdateRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String collection;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RunOutcome outcome;

    @Column(nullable = false)
    private int recordCount;

    @Column
    private Integer segmentCount;

    @Column(length = 100)
    private String errorType;

    @Column(length = 2000)
    private String error;

    @Column(nullable = false)
    private LocalDateTime finishedAt;
}
