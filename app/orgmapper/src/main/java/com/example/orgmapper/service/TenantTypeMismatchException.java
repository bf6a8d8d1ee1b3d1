package com.example.orgmapper.service;

public class TenantTypeMismatchException extends RuntimeException {

  public TenantTypeMismatchException(String message) {
    super(message);
  }
}
