package com.example.orgmapper.grafana;

import java.util.Map;

record SsoSettingsUpdateRequest(String provider, Map<String, Object> settings) {}
