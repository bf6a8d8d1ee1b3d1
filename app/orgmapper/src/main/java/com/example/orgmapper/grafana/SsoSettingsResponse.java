package com.example.orgmapper.grafana;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

// settings は型を固定せず、未知のプロバイダ固有キーも保持する
@JsonIgnoreProperties(ignoreUnknown = true)
record SsoSettingsResponse(String provider, Object settings) {}
