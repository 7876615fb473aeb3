package com.pricehistory.marketdata.client;

/**
 * Status and body of one completed HTTP exchange, before any retry decision.
 */
public record UpstreamResponse(int status, String body) {

    public UpstreamResponse {
        body = body == null ? "" : body;
    }
}
