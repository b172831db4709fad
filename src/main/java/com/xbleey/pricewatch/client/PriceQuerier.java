package com.xbleey.pricewatch.client;

import com.xbleey.pricewatch.enums.PricingRegion;

@FunctionalInterface
public interface PriceQuerier {

    PriceQuote query(String productId, PricingRegion region) throws PriceQueryException;
}
