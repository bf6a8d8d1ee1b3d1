package com.example.orgmapper.repository;

import com.example.orgmapper.model.TenantObservation;
import com.example.orgmapper.model.TenantParameters;
import com.example.orgmapper.model.TenantResource;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent home of tenant records. Each call is consistent on its own; nothing is guaranteed
 * across calls. All methods throw {@link TenantStoreException} when the backing store fails.
 */
public interface TenantStore {

  /** All tenants ordered by tenantId, then by name. */
  List<TenantResource> list();

  Optional<TenantResource> find(String name);

  /** Creates the record or replaces its desired state. Observation and deletion marker are kept. */
  TenantResource apply(String name, TenantParameters parameters, Instant now);

  void saveObservation(UUID uid, TenantObservation observation);

  /** Sets the deletion marker. Returns false when no record has that name. */
  boolean requestDeletion(String name, Instant now);

  /** Removes the record once its external effect has been withdrawn. */
  void remove(UUID uid);
}
