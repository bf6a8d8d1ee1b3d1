/*
 * どこで: org_mapping 文字列のエンコード/デコード
 * 何を: 全 Tenant のグループ claim を Grafana の org_mapping 1 本に変換し、照会する
 * なぜ: 副作用なしの純粋関数として reconcile と検証で共有するため
 */
package com.example.orgmapper.mapping;

import com.example.orgmapper.model.TenantMapping;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class OrgMappingCodec {

  private static final char ENTRY_SEPARATOR = ',';
  private static final char FIELD_SEPARATOR = ':';
  private static final char ESCAPE = '\\';
  private static final String ESCAPED_FIELD_SEPARATOR = "\\:";

  private OrgMappingCodec() {}

  /**
   * Builds the org_mapping value. Tenants are written in the given order; inside a tenant all
   * viewer groups come first, then editor groups, then admin groups.
   */
  public static String encode(List<TenantMapping> tenants) {
    if (tenants == null || tenants.isEmpty()) {
      return "";
    }
    final List<String> entries = new ArrayList<>();
    for (TenantMapping tenant : tenants) {
      if (tenant == null) {
        continue;
      }
      appendEntries(entries, tenant.viewerGroups(), tenant.orgId(), MappingRole.VIEWER);
      appendEntries(entries, tenant.editorGroups(), tenant.orgId(), MappingRole.EDITOR);
      appendEntries(entries, tenant.adminGroups(), tenant.orgId(), MappingRole.ADMIN);
    }
    return String.join(String.valueOf(ENTRY_SEPARATOR), entries);
  }

  /**
   * Reports whether the document carries the default {@code orgId:orgId:Viewer} entry for the
   * given org.
   */
  public static boolean contains(String document, String orgId) {
    if (document == null || document.isEmpty()) {
      return false;
    }
    final String expected = orgId + FIELD_SEPARATOR + orgId + FIELD_SEPARATOR + "Viewer";
    for (String part : splitEntries(document)) {
      if (part.trim().equals(expected)) {
        return true;
      }
    }
    return false;
  }

  /** Parses the document. Entries that do not have three fields and a known role are skipped. */
  public static List<MappingEntry> entries(String document) {
    final List<MappingEntry> parsed = new ArrayList<>();
    if (document == null || document.isEmpty()) {
      return parsed;
    }
    for (String part : splitEntries(document)) {
      parseEntry(part.trim()).ifPresent(parsed::add);
    }
    return parsed;
  }

  /**
   * Escapes {@code :} only. The format has no escape for the backslash itself, so a subject ending
   * in a backslash would swallow the following separator; such subjects are rejected on input.
   */
  public static String escape(String subject) {
    return subject.replace(String.valueOf(FIELD_SEPARATOR), ESCAPED_FIELD_SEPARATOR);
  }

  public static String unescape(String subject) {
    return subject.replace(ESCAPED_FIELD_SEPARATOR, String.valueOf(FIELD_SEPARATOR));
  }

  @VisibleForTesting
  static List<String> splitEntries(String document) {
    final List<String> parts = new ArrayList<>();
    final StringBuilder current = new StringBuilder();
    for (int i = 0; i < document.length(); i++) {
      final char c = document.charAt(i);
      if (c == ESCAPE && i + 1 < document.length()) {
        // エスケープされた文字は区切りとして扱わない
        current.append(c).append(document.charAt(i + 1));
        i++;
      } else if (c == ENTRY_SEPARATOR) {
        parts.add(current.toString());
        current.setLength(0);
      } else {
        current.append(c);
      }
    }
    parts.add(current.toString());
    return parts;
  }

  private static void appendEntries(
      List<String> entries, List<String> groups, String orgId, MappingRole role) {
    if (groups == null) {
      return;
    }
    for (String group : groups) {
      if (group == null) {
        continue;
      }
      entries.add(escape(group) + FIELD_SEPARATOR + orgId + FIELD_SEPARATOR + role.label());
    }
  }

  private static Optional<MappingEntry> parseEntry(String entry) {
    final int subjectEnd = firstUnescapedSeparator(entry);
    final int roleStart = entry.lastIndexOf(FIELD_SEPARATOR);
    if (subjectEnd < 0 || roleStart <= subjectEnd) {
      return Optional.empty();
    }
    // orgId は未エスケープなので、最初と最後の区切りの間をそのまま使う
    final String subject = unescape(entry.substring(0, subjectEnd));
    final String orgId = entry.substring(subjectEnd + 1, roleStart);
    return MappingRole.fromLabel(entry.substring(roleStart + 1))
        .map(role -> new MappingEntry(subject, orgId, role));
  }

  private static int firstUnescapedSeparator(String entry) {
    for (int i = 0; i < entry.length(); i++) {
      final char c = entry.charAt(i);
      if (c == ESCAPE) {
        i++;
      } else if (c == FIELD_SEPARATOR) {
        return i;
      }
    }
    return -1;
  }
}
