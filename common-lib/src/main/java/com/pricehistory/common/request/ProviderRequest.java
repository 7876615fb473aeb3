package com.pricehistory.common.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider function identifier plus its query parameters, in emission order.
 * Never contains the API key.
 */
public record ProviderRequest(String functionId, Map<String, String> params) {

    public ProviderRequest {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public String param(String name) {
        return params.get(name);
    }
}
