/*
 * どこで: OrgMapper データアクセス
 * 何を: tenants テーブルの desired/observed state を読み書きする
 * なぜ: reconcile が全 Tenant の集合を一貫した順序で取得できるようにするため
 */
package com.example.orgmapper.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.orgmapper.model.TenantObservation;
import com.example.orgmapper.model.TenantParameters;
import com.example.orgmapper.model.TenantResource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcTenantStore implements TenantStore {

  private static final String COLUMNS =
      "uid, name, parameters_json, observation_json, deletion_requested_at, created_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  @Override
  public List<TenantResource> list() {
    // org_mapping の出力順を固定するため tenant_id → name の順で返す
    final String sql = "SELECT " + COLUMNS + " FROM tenants ORDER BY tenant_id, name";
    try {
      return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
    } catch (DataAccessException ex) {
      throw new TenantStoreException("cannot list tenants", ex);
    }
  }

  @Override
  public Optional<TenantResource> find(String name) {
    final String sql = "SELECT " + COLUMNS + " FROM tenants WHERE name = :name";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("name", name);
    try {
      return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
    } catch (DataAccessException ex) {
      throw new TenantStoreException("cannot get tenant name=" + name, ex);
    }
  }

  @Override
  public TenantResource apply(String name, TenantParameters parameters, Instant now) {
    final String sql =
        """
        INSERT INTO tenants (
          uid,
          name,
          tenant_id,
          org_id,
          parameters_json,
          observation_json,
          deletion_requested_at,
          created_at,
          updated_at
        ) VALUES (
          :uid,
          :name,
          :tenantId,
          :orgId,
          :parametersJson,
          NULL,
          NULL,
          :now,
          :now
        )
        ON CONFLICT (name)
        DO UPDATE SET
          tenant_id = EXCLUDED.tenant_id,
          org_id = EXCLUDED.org_id,
          parameters_json = EXCLUDED.parameters_json,
          updated_at = EXCLUDED.updated_at
        RETURNING uid, name, parameters_json, observation_json, deletion_requested_at, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("uid", UUID.randomUUID())
            .addValue("name", name)
            .addValue("tenantId", parameters.tenantId())
            .addValue("orgId", parameters.orgId())
            .addValue("parametersJson", writeJson(parameters))
            .addValue("now", toTimestamp(now));
    try {
      return jdbcTemplate.query(sql, params, this::mapRow).stream()
          .findFirst()
          .orElseThrow(() -> new IllegalStateException("upsert returned no row name=" + name));
    } catch (DataAccessException ex) {
      throw new TenantStoreException("cannot apply tenant name=" + name, ex);
    }
  }

  @Override
  public void saveObservation(UUID uid, TenantObservation observation) {
    final String sql =
        """
        UPDATE tenants
        SET observation_json = :observationJson
        WHERE uid = :uid
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("uid", uid)
            .addValue("observationJson", writeJson(observation));
    try {
      jdbcTemplate.update(sql, params);
    } catch (DataAccessException ex) {
      throw new TenantStoreException("cannot save tenant observation uid=" + uid, ex);
    }
  }

  @Override
  public boolean requestDeletion(String name, Instant now) {
    // 既に削除要求済みなら最初の時刻を維持する
    final String sql =
        """
        UPDATE tenants
        SET deletion_requested_at = COALESCE(deletion_requested_at, :now),
            updated_at = :now
        WHERE name = :name
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("name", name).addValue("now", toTimestamp(now));
    try {
      return jdbcTemplate.update(sql, params) > 0;
    } catch (DataAccessException ex) {
      throw new TenantStoreException("cannot mark tenant for deletion name=" + name, ex);
    }
  }

  @Override
  public void remove(UUID uid) {
    final String sql = "DELETE FROM tenants WHERE uid = :uid";
    try {
      jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("uid", uid));
    } catch (DataAccessException ex) {
      throw new TenantStoreException("cannot remove tenant uid=" + uid, ex);
    }
  }

  private TenantResource mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String observationJson = rs.getString("observation_json");
    return new TenantResource(
        rs.getString("name"),
        rs.getObject("uid", UUID.class),
        readJson(rs.getString("parameters_json"), TenantParameters.class),
        observationJson == null ? null : readJson(observationJson, TenantObservation.class),
        toInstant(rs.getTimestamp("deletion_requested_at")),
        toInstant(rs.getTimestamp("created_at")));
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new TenantStoreException("cannot serialize tenant state", ex);
    }
  }

  private <T> T readJson(String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new TenantStoreException("cannot deserialize tenant state", ex);
    }
  }
}
