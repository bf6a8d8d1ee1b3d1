package com.example.orgmapper.model;

import java.util.List;

/** The part of a tenant that ends up in the org_mapping document. */
public record TenantMapping(
    String orgId, List<String> viewerGroups, List<String> editorGroups, List<String> adminGroups) {

  public static TenantMapping from(TenantParameters parameters) {
    return new TenantMapping(
        parameters.orgId(),
        parameters.viewerGroups(),
        parameters.editorGroups(),
        parameters.adminGroups());
  }
}
