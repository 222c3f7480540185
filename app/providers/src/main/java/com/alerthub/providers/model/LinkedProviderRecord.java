package com.alerthub.providers.model;

import java.time.Instant;

/** アラートは届いているがインストールレコードを持たない送信元。 */
public record LinkedProviderRecord(
    String providerType, String providerId, Instant lastAlertReceived) {}
