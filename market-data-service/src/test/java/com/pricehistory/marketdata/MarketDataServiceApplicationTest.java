package com.pricehistory.marketdata;

import com.pricehistory.common.retry.RetryPolicy;
import com.pricehistory.marketdata.client.ResilientHttpClient;
import com.pricehistory.marketdata.provider.PriceHistoryProvider;
import com.pricehistory.marketdata.service.AssetAggregator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class MarketDataServiceApplicationTest {

    @Autowired
    private PriceHistoryProvider provider;

    @Autowired
    private ResilientHttpClient httpClient;

    @Test
    void contextWiresAggregatorWithConfiguredRetryPolicy() {
        assertInstanceOf(AssetAggregator.class, provider);

        RetryPolicy policy = httpClient.getRetryPolicy();
        assertEquals(3, policy.getMaxRetries());
        assertEquals(Duration.ofMillis(10), policy.getBackoffFactor());
    }
}
