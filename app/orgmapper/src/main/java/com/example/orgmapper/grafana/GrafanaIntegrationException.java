package com.example.orgmapper.grafana;

public class GrafanaIntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    FORBIDDEN,
    REJECTED,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public GrafanaIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public GrafanaIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
