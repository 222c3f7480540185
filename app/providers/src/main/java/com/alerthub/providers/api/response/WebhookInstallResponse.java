package com.alerthub.providers.api.response;

public record WebhookInstallResponse(boolean installed) {}
