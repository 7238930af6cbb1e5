package com.gamearr.model;

public record MetadataCandidate(
        String externalId,
        String title,
        Integer year,
        String platform
) {}
