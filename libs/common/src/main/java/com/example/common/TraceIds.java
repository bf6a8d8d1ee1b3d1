package com.example.common;

import java.util.Locale;
import java.util.UUID;

/** Trace ids for work that does not start from an incoming traced request. */
public final class TraceIds {

  private static final int TRACE_ID_LENGTH = 32;

  private TraceIds() {}

  // W3C trace-context と同じ 32 桁の小文字 16 進で揃え、ログ上で見分けが付かないようにする
  public static String newTraceId() {
    final UUID uuid = UUID.randomUUID();
    return String.format(
        Locale.ROOT, "%016x%016x", uuid.getMostSignificantBits(), uuid.getLeastSignificantBits());
  }

  public static boolean isValid(String traceId) {
    if (traceId == null || traceId.length() != TRACE_ID_LENGTH) {
      return false;
    }
    boolean allZero = true;
    for (int i = 0; i < traceId.length(); i++) {
      final char c = traceId.charAt(i);
      final boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f');
      if (!hex) {
        return false;
      }
      if (c != '0') {
        allZero = false;
      }
    }
    return !allZero;
  }
}
