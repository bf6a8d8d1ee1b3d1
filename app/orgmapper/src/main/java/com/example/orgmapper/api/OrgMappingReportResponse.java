package com.example.orgmapper.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrgMappingReportResponse(
    boolean providerConfigured,
    String current,
    String expected,
    boolean inSync,
    List<OrgMappingEntryResponse> entries) {}
