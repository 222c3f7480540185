package com.alerthub.providers.api.response;

import java.util.List;

public record ProviderMethodView(String name, String description, List<String> parameters) {}
