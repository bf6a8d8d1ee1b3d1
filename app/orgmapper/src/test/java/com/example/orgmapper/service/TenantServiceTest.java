package com.example.orgmapper.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.orgmapper.api.TenantRequest;
import com.example.orgmapper.api.TenantResponse;
import com.example.orgmapper.model.RetentionPolicy;
import com.example.orgmapper.model.TenantObservation;
import com.example.orgmapper.model.TenantParameters;
import com.example.orgmapper.model.TenantResource;
import com.example.orgmapper.repository.TenantStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TenantServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final RetentionPolicy RETENTION = new RetentionPolicy("30d", "30d", "7d", "");

  @Mock private TenantStore tenantStore;

  private TenantService service;

  @BeforeEach
  void setUp() {
    service = new TenantService(tenantStore, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void applyStoresDesiredStateAndReportsAbsentUntilReconciled() {
    final TenantRequest request =
        new TenantRequest(
            "acme", "org-1", List.of("alice"), List.of("team-a"), null, null, RETENTION);
    when(tenantStore.apply(eq("acme"), any(), eq(FIXED_NOW)))
        .thenAnswer(
            invocation ->
                new TenantResource(
                    "acme",
                    UUID.randomUUID(),
                    invocation.getArgument(1),
                    null,
                    null,
                    FIXED_NOW));

    final TenantResponse response = service.apply("acme", request);

    final ArgumentCaptor<TenantParameters> captor =
        ArgumentCaptor.forClass(TenantParameters.class);
    verify(tenantStore).apply(eq("acme"), captor.capture(), eq(FIXED_NOW));
    assertThat(captor.getValue().viewerGroups()).containsExactly("team-a");
    assertThat(captor.getValue().retention()).isEqualTo(RETENTION);
    assertThat(response.tenantId()).isEqualTo("acme");
    assertThat(response.status().state()).isEqualTo("ABSENT");
    assertThat(response.status().lastUpdated()).isNull();
  }

  @Test
  void applyRejectsBlankName() {
    final TenantRequest request =
        new TenantRequest("acme", "org-1", null, null, null, null, null);

    assertThatThrownBy(() -> service.apply(" ", request))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("name is required");
    verifyNoInteractions(tenantStore);
  }

  @Test
  void applyRejectsMissingBody() {
    assertThatThrownBy(() -> service.apply("acme", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("request body is required");
  }

  @Test
  void getReportsObservedStatus() {
    final TenantParameters parameters =
        new TenantParameters("acme", "org-1", null, List.of("team-a"), null, null, RETENTION);
    when(tenantStore.find("acme"))
        .thenReturn(
            Optional.of(
                new TenantResource(
                    "acme",
                    UUID.randomUUID(),
                    parameters,
                    TenantObservation.of(parameters, FIXED_NOW),
                    null,
                    FIXED_NOW)));

    final TenantResponse response = service.get("acme");

    assertThat(response.status().state()).isEqualTo("SYNCED");
    assertThat(response.status().orgId()).isEqualTo("org-1");
    assertThat(response.status().lastUpdated()).isEqualTo("2026-01-17T00:00:00Z");
  }

  @Test
  void getReportsPendingChangeAsNotSynced() {
    final TenantParameters observed =
        new TenantParameters("acme", "org-1", null, List.of("team-a"), null, null, RETENTION);
    final TenantParameters desired =
        new TenantParameters("acme", "org-2", null, List.of("team-a"), null, null, RETENTION);
    when(tenantStore.find("acme"))
        .thenReturn(
            Optional.of(
                new TenantResource(
                    "acme",
                    UUID.randomUUID(),
                    desired,
                    TenantObservation.of(observed, FIXED_NOW),
                    null,
                    FIXED_NOW)));

    assertThat(service.get("acme").status().state()).isEqualTo("EXISTS_NOT_SYNCED");
  }

  @Test
  void getReportsDeletingTenant() {
    when(tenantStore.find("acme"))
        .thenReturn(
            Optional.of(
                new TenantResource(
                    "acme",
                    UUID.randomUUID(),
                    new TenantParameters("acme", "org-1", null, null, null, null, RETENTION),
                    null,
                    FIXED_NOW,
                    FIXED_NOW)));

    assertThat(service.get("acme").status().state()).isEqualTo("DELETING");
  }

  @Test
  void getThrowsNotFoundForUnknownTenant() {
    when(tenantStore.find("ghost")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.get("ghost"))
        .isInstanceOf(TenantNotFoundException.class)
        .hasMessage("tenant not found: ghost");
  }

  @Test
  void requestDeletionMarksTenant() {
    when(tenantStore.requestDeletion("acme", FIXED_NOW)).thenReturn(true);

    service.requestDeletion("acme");

    verify(tenantStore).requestDeletion("acme", FIXED_NOW);
  }

  @Test
  void requestDeletionThrowsNotFoundForUnknownTenant() {
    when(tenantStore.requestDeletion("ghost", FIXED_NOW)).thenReturn(false);

    assertThatThrownBy(() -> service.requestDeletion("ghost"))
        .isInstanceOf(TenantNotFoundException.class);
  }
}
