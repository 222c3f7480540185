package com.alerthub.providers.api.response;

import java.util.List;
import java.util.Map;

public record AlertsResponse(List<Map<String, Object>> alerts) {}
