package com.alerthub.providers.api.response;

public record MessageResponse(String message) {}
