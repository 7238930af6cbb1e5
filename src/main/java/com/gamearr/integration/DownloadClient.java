package com.gamearr.integration;

import com.gamearr.model.AcquisitionRequest;
import com.gamearr.model.ActiveDownload;

import java.util.List;
import java.util.Optional;

public interface DownloadClient {

    boolean isConfigured();

    /**
     * Lightweight reachability probe for health reporting. Never throws.
     */
    default boolean testConnection() {
        return isConfigured();
    }

    /**
     * @return an acknowledgement from the client, usually a short status text
     */
    String submit(AcquisitionRequest request);

    Optional<ActiveDownload> pollStatus(String handle);

    List<ActiveDownload> listDownloads(String category);
}
