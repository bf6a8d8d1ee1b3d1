/*
 * どこで: OrgMapper API
 * 何を: Tenant の desired state を登録/参照/削除し、即時 reconcile を受け付ける
 * なぜ: Tenant の所有者が Grafana を直接触らずに org_mapping を管理できるようにするため
 */
package com.example.orgmapper.api;

import com.example.orgmapper.model.ReconcileOutcome;
import com.example.orgmapper.service.TenantNotFoundException;
import com.example.orgmapper.service.TenantReconcileService;
import com.example.orgmapper.service.TenantService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/tenants")
@RequiredArgsConstructor
public class TenantController {

  private final TenantService tenantService;
  private final TenantReconcileService reconcileService;

  @PutMapping("/{name}")
  public TenantResponse apply(
      @PathVariable("name") String name, @Valid @RequestBody TenantRequest request) {
    return tenantService.apply(name, request);
  }

  @GetMapping
  public List<TenantResponse> list() {
    return tenantService.list();
  }

  @GetMapping("/{name}")
  public TenantResponse get(@PathVariable("name") String name) {
    return tenantService.get(name);
  }

  @DeleteMapping("/{name}")
  public ResponseEntity<Void> delete(@PathVariable("name") String name) {
    tenantService.requestDeletion(name);
    return ResponseEntity.status(HttpStatus.ACCEPTED).build();
  }

  @PostMapping("/{name}/reconcile")
  public ReconcileResponse reconcile(@PathVariable("name") String name) {
    final ReconcileOutcome outcome = reconcileService.reconcile(name);
    if (outcome == ReconcileOutcome.GONE) {
      throw new TenantNotFoundException(name);
    }
    return new ReconcileResponse(name, outcome.name());
  }
}
