package com.example.orgmapper.api;

import com.example.orgmapper.service.OrgMappingReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class OrgMappingController {

  private final OrgMappingReportService reportService;

  @GetMapping("/v1/org-mapping")
  public OrgMappingReportResponse report() {
    return reportService.report();
  }
}
