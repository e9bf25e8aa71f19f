package com.eli5y.interfaces.api.dto;

public record StatusResponse(String message, String version, String environment) {}
