package com.whereq.vigil.repository;

import com.whereq.vigil.model.ScheduleStatus;
import com.whereq.vigil.model.ScheduledScan;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CRUD contract for scheduled scans.
 * Records going in and out are copies; callers never share a stored instance.
 * Storage failures surface as {@link com.whereq.vigil.exception.PersistenceException}.
 */
public interface ScheduledScanRepository {

    /**
     * Insert or replace a record. A record without id gets the next one.
     *
     * @return stored copy, with its id
     */
    ScheduledScan save(ScheduledScan scan);

    Optional<ScheduledScan> findById(long id);

    /**
     * All records, newest first
     */
    List<ScheduledScan> findAllOrderByCreatedAtDesc();

    List<ScheduledScan> findByStatusIn(Collection<ScheduleStatus> statuses);

    /**
     * @return true if a record was removed
     */
    boolean deleteById(long id);

    Optional<Map<String, Object>> getMetadata(long id);

    /**
     * @return true if the record exists and was updated
     */
    boolean setMetadata(long id, Map<String, Object> metadata);
}
