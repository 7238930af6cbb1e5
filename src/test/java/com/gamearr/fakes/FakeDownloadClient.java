package com.gamearr.fakes;

import com.gamearr.integration.DownloadClient;
import com.gamearr.model.AcquisitionRequest;
import com.gamearr.model.ActiveDownload;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class FakeDownloadClient implements DownloadClient {

    public boolean configured = true;
    public final List<AcquisitionRequest> submitted = new ArrayList<>();
    public List<ActiveDownload> downloads = new ArrayList<>();
    public RuntimeException failure;

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public String submit(AcquisitionRequest request) {
        if (failure != null) throw failure;
        submitted.add(request);
        return "Ok.";
    }

    @Override
    public Optional<ActiveDownload> pollStatus(String handle) {
        return downloads.stream().filter(d -> d.handle().equals(handle)).findFirst();
    }

    @Override
    public List<ActiveDownload> listDownloads(String category) {
        if (failure != null) throw failure;
        return downloads;
    }
}
