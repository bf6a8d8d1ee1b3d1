package com.example.orgmapper.api;

public record ReconcileResponse(String name, String outcome) {}
