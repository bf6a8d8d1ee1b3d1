package com.example.orgmapper.api;

import com.example.orgmapper.model.RetentionPolicy;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TenantRequest(
    @NotBlank(message = "tenant_id is required") String tenantId,
    @NotBlank(message = "org_id is required") String orgId,
    List<String> admins,
    List<
            @Pattern(
                regexp = TenantRequest.NO_TRAILING_BACKSLASH,
                message = TenantRequest.GROUP_MESSAGE)
            String>
        viewerGroups,
    List<
            @Pattern(
                regexp = TenantRequest.NO_TRAILING_BACKSLASH,
                message = TenantRequest.GROUP_MESSAGE)
            String>
        editorGroups,
    List<
            @Pattern(
                regexp = TenantRequest.NO_TRAILING_BACKSLASH,
                message = TenantRequest.GROUP_MESSAGE)
            String>
        adminGroups,
    RetentionPolicy retention) {

  // 末尾の \ は org_mapping 上で直後の ':' をエスケープしてしまい、エントリが読めなくなる
  static final String NO_TRAILING_BACKSLASH = "(?s).*(?<!\\\\)";
  static final String GROUP_MESSAGE = "group names must not end with a backslash";
}
