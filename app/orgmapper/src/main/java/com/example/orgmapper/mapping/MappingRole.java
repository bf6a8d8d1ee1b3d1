package com.example.orgmapper.mapping;

import java.util.Optional;

public enum MappingRole {
  VIEWER("Viewer"),
  EDITOR("Editor"),
  ADMIN("Admin");

  private final String label;

  MappingRole(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public static Optional<MappingRole> fromLabel(String label) {
    for (MappingRole role : values()) {
      if (role.label.equals(label)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }
}
