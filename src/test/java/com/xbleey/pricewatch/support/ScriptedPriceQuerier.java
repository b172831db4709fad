package com.xbleey.pricewatch.support;

import com.xbleey.pricewatch.client.PriceQuerier;
import com.xbleey.pricewatch.client.PriceQueryException;
import com.xbleey.pricewatch.client.PriceQuote;
import com.xbleey.pricewatch.enums.FailureKind;
import com.xbleey.pricewatch.enums.PricingRegion;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Answers each product from its own queue of scripted responses. An exhausted queue keeps
 * repeating its last response.
 */
public class ScriptedPriceQuerier implements PriceQuerier {

    private final Map<String, Deque<Object>> scripts = new HashMap<>();
    private final Map<String, Object> lastResponses = new HashMap<>();
    private final Map<String, Integer> callsByProduct = new HashMap<>();
    private int calls;

    public synchronized ScriptedPriceQuerier price(String productId, String... prices) {
        for (String price : prices) {
            queue(productId).add(new PriceQuote(productId, new BigDecimal(price), "EUR", null));
        }
        return this;
    }

    public synchronized ScriptedPriceQuerier fail(String productId, FailureKind kind, int times) {
        for (int i = 0; i < times; i++) {
            queue(productId).add(kind);
        }
        return this;
    }

    public synchronized int callCount() {
        return calls;
    }

    public synchronized int callCount(String productId) {
        return callsByProduct.getOrDefault(productId, 0);
    }

    @Override
    public PriceQuote query(String productId, PricingRegion region) throws PriceQueryException {
        Object next;
        synchronized (this) {
            calls++;
            callsByProduct.merge(productId, 1, Integer::sum);
            Deque<Object> script = scripts.get(productId);
            next = script == null || script.isEmpty() ? lastResponses.get(productId) : script.poll();
            lastResponses.put(productId, next);
        }
        if (next == null) {
            throw PriceQueryException.permanent("Unknown product " + productId);
        }
        if (next instanceof FailureKind kind) {
            throw switch (kind) {
                case RATE_LIMITED -> PriceQueryException.rateLimited("scripted rate limit");
                case TRANSIENT -> PriceQueryException.transientFailure("scripted outage");
                case PERMANENT -> PriceQueryException.permanent("scripted not found");
            };
        }
        return (PriceQuote) next;
    }

    private Deque<Object> queue(String productId) {
        return scripts.computeIfAbsent(productId, key -> new ArrayDeque<>());
    }
}
