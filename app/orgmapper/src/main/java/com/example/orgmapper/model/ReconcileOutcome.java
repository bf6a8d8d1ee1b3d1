package com.example.orgmapper.model;

public enum ReconcileOutcome {
  CREATED,
  UPDATED,
  NO_OP,
  DELETED,
  GONE
}
