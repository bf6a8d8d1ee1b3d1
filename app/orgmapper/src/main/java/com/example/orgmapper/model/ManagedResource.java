package com.example.orgmapper.model;

import java.util.UUID;

/** A record handed to the reconciler by the scheduling side. */
public interface ManagedResource {

  String name();

  UUID uid();

  String kind();
}
