package com.gamearr.model;

import java.util.List;

/**
 * Options handed to the download client when a release is submitted.
 */
public record AcquisitionRequest(
        String downloadUrl,
        String category,
        List<String> tags,
        boolean paused
) {}
