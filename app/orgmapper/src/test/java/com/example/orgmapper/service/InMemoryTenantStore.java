package com.example.orgmapper.service;

import com.example.orgmapper.model.TenantObservation;
import com.example.orgmapper.model.TenantParameters;
import com.example.orgmapper.model.TenantResource;
import com.example.orgmapper.repository.TenantStore;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Map-backed store with the same ordering contract as the JDBC one. */
class InMemoryTenantStore implements TenantStore {

  private final Map<String, TenantResource> tenants = new LinkedHashMap<>();

  @Override
  public synchronized List<TenantResource> list() {
    return tenants.values().stream()
        .sorted(
            Comparator.comparing((TenantResource t) -> t.parameters().tenantId())
                .thenComparing(TenantResource::name))
        .toList();
  }

  @Override
  public synchronized Optional<TenantResource> find(String name) {
    return Optional.ofNullable(tenants.get(name));
  }

  @Override
  public synchronized TenantResource apply(
      String name, TenantParameters parameters, Instant now) {
    final TenantResource existing = tenants.get(name);
    final TenantResource applied =
        existing == null
            ? new TenantResource(name, UUID.randomUUID(), parameters, null, null, now)
            : new TenantResource(
                name,
                existing.uid(),
                parameters,
                existing.observation(),
                existing.deletionRequestedAt(),
                existing.createdAt());
    tenants.put(name, applied);
    return applied;
  }

  @Override
  public synchronized void saveObservation(UUID uid, TenantObservation observation) {
    tenants.replaceAll(
        (name, tenant) -> tenant.uid().equals(uid) ? tenant.withObservation(observation) : tenant);
  }

  @Override
  public synchronized boolean requestDeletion(String name, Instant now) {
    final TenantResource existing = tenants.get(name);
    if (existing == null) {
      return false;
    }
    if (!existing.deletionRequested()) {
      tenants.put(
          name,
          new TenantResource(
              name,
              existing.uid(),
              existing.parameters(),
              existing.observation(),
              now,
              existing.createdAt()));
    }
    return true;
  }

  @Override
  public synchronized void remove(UUID uid) {
    tenants.values().removeIf(tenant -> tenant.uid().equals(uid));
  }
}
