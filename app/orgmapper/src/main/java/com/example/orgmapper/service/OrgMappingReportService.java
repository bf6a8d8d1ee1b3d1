/*
 * どこで: OrgMapper サービス層
 * 何を: Grafana 上の orgMapping と全 Tenant から計算した期待値を並べて返す
 * なぜ: drift の有無を運用者が API から直接確認できるようにするため
 */
package com.example.orgmapper.service;

import com.example.orgmapper.api.OrgMappingEntryResponse;
import com.example.orgmapper.api.OrgMappingReportResponse;
import com.example.orgmapper.mapping.MappingEntry;
import com.example.orgmapper.mapping.OrgMappingCodec;
import com.example.orgmapper.model.TenantMapping;
import com.example.orgmapper.model.TenantResource;
import com.example.orgmapper.repository.TenantStore;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OrgMappingReportService {

  private final TenantStore tenantStore;
  private final OrgMappingSyncService syncService;

  public OrgMappingReportResponse report() {
    final List<TenantMapping> mappings =
        tenantStore.list().stream()
            .map(TenantResource::parameters)
            .map(TenantMapping::from)
            .toList();
    final String expected = OrgMappingCodec.encode(mappings);
    final Optional<String> current = syncService.currentMapping();
    final List<OrgMappingEntryResponse> entries =
        OrgMappingCodec.entries(current.orElse("")).stream().map(this::toEntry).toList();
    return new OrgMappingReportResponse(
        current.isPresent(),
        current.orElse(""),
        expected,
        expected.equals(current.orElse("")),
        entries);
  }

  private OrgMappingEntryResponse toEntry(MappingEntry entry) {
    return new OrgMappingEntryResponse(entry.subject(), entry.orgId(), entry.role().label());
  }
}
