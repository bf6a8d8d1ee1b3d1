package com.example.orgmapper.service;

public class TenantConflictException extends RuntimeException {

  public TenantConflictException(String message) {
    super(message);
  }
}
