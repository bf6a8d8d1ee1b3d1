package com.example.orgmapper.service;

public class TenantNotFoundException extends RuntimeException {

  public TenantNotFoundException(String name) {
    super("tenant not found: " + name);
  }
}
