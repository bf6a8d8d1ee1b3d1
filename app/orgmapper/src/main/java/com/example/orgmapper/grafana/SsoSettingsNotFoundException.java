package com.example.orgmapper.grafana;

public class SsoSettingsNotFoundException extends RuntimeException {

  public SsoSettingsNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
