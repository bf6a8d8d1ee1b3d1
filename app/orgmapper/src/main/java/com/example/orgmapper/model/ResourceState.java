package com.example.orgmapper.model;

public enum ResourceState {
  ABSENT,
  EXISTS_NOT_SYNCED,
  SYNCED
}
