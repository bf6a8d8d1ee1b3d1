package com.example.orgmapper.api;

import com.example.orgmapper.model.RetentionPolicy;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TenantResponse(
    String name,
    String uid,
    String tenantId,
    String orgId,
    List<String> admins,
    List<String> viewerGroups,
    List<String> editorGroups,
    List<String> adminGroups,
    RetentionPolicy retention,
    TenantStatusResponse status) {}
