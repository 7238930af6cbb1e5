package com.gamearr.integration;

import com.gamearr.model.CatalogEntry;
import com.gamearr.model.PendingAcquisition;
import com.gamearr.model.ReleaseInfo;
import com.gamearr.model.UpdateCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for catalog entries. Implementations may throw unchecked exceptions on
 * storage failure; jobs treat those as failures of the current item only.
 */
public interface CatalogStore {

    List<CatalogEntry> listMonitoredWanted();

    List<CatalogEntry> listAcquired();

    Optional<CatalogEntry> findById(long id);

    List<PendingAcquisition> listPendingAcquisitions();

    void markAcquiring(long id, ReleaseInfo release);

    void markAcquired(long id, ReleaseInfo release);

    /**
     * Drops the pending acquisition. A monitored entry goes back to wanted.
     */
    void markFailed(long id);

    List<UpdateCandidate> listUpdates(long id);

    void recordUpdates(long id, List<UpdateCandidate> updates);
}
