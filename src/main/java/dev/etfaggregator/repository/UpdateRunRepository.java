package dev.etfaggregator.repository;

import dev.etfaggregator.entity.UpdateRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for update run history.
 */
@Repository
public interface UpdateRunRepository extends JpaRepository<UpdateRun, Long> {

    /**
     * Most recent runs first.
     */
    List<UpdateRun> findAllByOrderByFinishedAtDesc(Pageable pageable);
}
