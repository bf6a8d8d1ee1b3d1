package com.example.orgmapper.repository;

public class TenantStoreException extends RuntimeException {

  public TenantStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
