package com.alerthub.providers.api.response;

public record AlertCountResponse(long count) {}
