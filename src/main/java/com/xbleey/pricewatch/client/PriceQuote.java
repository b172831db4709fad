package com.xbleey.pricewatch.client;

import java.math.BigDecimal;

/**
 * Price returned by the pricing service; {@code currency} and {@code title} may be absent.
 */
public record PriceQuote(String productId, BigDecimal price, String currency, String title) {
}
