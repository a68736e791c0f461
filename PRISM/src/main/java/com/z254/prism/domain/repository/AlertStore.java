package com.z254.prism.domain.repository;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.AlertQuery;
import com.z254.prism.domain.model.IngestResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Bounded store that owns the lifetime of every alert.
 * <p>
 * All read operations return detached copies; mutation happens only through this interface.
 */
public interface AlertStore {

    /**
     * Admit an alert, folding it into an existing one when it is a duplicate or a resolution.
     * <p>
     * A firing alert whose fingerprint matches a firing alert within the repeat window is folded
     * into it, whether or not either is flagged as noise. Eviction of the oldest alerts happens
     * before this method returns.
     *
     * @return {@link IngestResult#ACCEPTED}, {@link IngestResult#DEDUPLICATED} or
     *         {@link IngestResult#RESOLVED}
     */
    IngestResult ingest(Alert alert);

    Optional<Alert> findById(String id);

    boolean contains(String id);

    /**
     * Alerts matching the query, ordered by timestamp.
     */
    List<Alert> query(AlertQuery query);

    /**
     * Correlatable (firing, non-suppressed) alerts with a timestamp in {@code [from, to]},
     * ordered by timestamp.
     */
    List<Alert> snapshot(Instant from, Instant to);

    /**
     * Alerts currently flagged as noise.
     */
    List<Alert> findSuppressed();

    /**
     * Set or clear the noise flag of a stored alert.
     *
     * @return false if the alert is no longer stored
     */
    boolean updateSuppressed(String id, boolean suppressed);

    /**
     * Stamp an alert as acknowledged. Status is left unchanged.
     */
    Optional<Alert> acknowledge(String id, String acknowledgedBy, Instant at);

    /**
     * Drop the oldest alerts until the store is within capacity.
     *
     * @return ids of the evicted alerts
     */
    List<String> evictIfOverCapacity();

    int size();

    int capacity();
}
