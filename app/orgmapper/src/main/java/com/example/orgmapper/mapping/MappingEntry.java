package com.example.orgmapper.mapping;

/** One {@code subject:orgId:Role} entry with the subject already unescaped. */
public record MappingEntry(String subject, String orgId, MappingRole role) {}
