package com.xbleey.pricewatch.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.pricewatch.config.PriceWatchProperties;
import com.xbleey.pricewatch.enums.PricingRegion;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;

@Component
public class HttpPriceQuerier implements PriceQuerier {

    private static final Logger log = LoggerFactory.getLogger(HttpPriceQuerier.class);

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final PriceWatchProperties properties;

    public HttpPriceQuerier(OkHttpClient okHttpClient, ObjectMapper objectMapper, PriceWatchProperties properties) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public PriceQuote query(String productId, PricingRegion region) throws PriceQueryException {
        HttpUrl url = resolveUrl(productId, region);
        Request request = new Request.Builder()
                .url(url)
                .get()
                .build();
        try (Response httpResponse = okHttpClient.newCall(request).execute()) {
            int code = httpResponse.code();
            if (code == 429) {
                throw PriceQueryException.rateLimited("Pricing API rate limited " + productId);
            }
            if (code == 404 || code == 410) {
                throw PriceQueryException.permanent("Product " + productId + " not found (http " + code + ")");
            }
            if (code >= 500) {
                throw PriceQueryException.transientFailure("Pricing API returned http status " + code);
            }
            if (!httpResponse.isSuccessful()) {
                throw PriceQueryException.permanent("Pricing API rejected " + productId + " (http " + code + ")");
            }
            ResponseBody body = httpResponse.body();
            if (body == null) {
                throw PriceQueryException.transientFailure("Pricing API returned empty body");
            }
            PriceQuote quote = objectMapper.readValue(body.byteStream(), PriceQuote.class);
            if (quote == null || quote.price() == null || quote.price().compareTo(BigDecimal.ZERO) <= 0) {
                throw PriceQueryException.transientFailure("Pricing API returned no price for " + productId);
            }
            log.debug("Quoted {} in {}: {} {}", productId, region, quote.price(), quote.currency());
            return quote;
        } catch (IOException ex) {
            throw PriceQueryException.transientFailure("Pricing API call failed for " + productId, ex);
        }
    }

    private HttpUrl resolveUrl(String productId, PricingRegion region) throws PriceQueryException {
        if (productId == null || productId.isBlank()) {
            throw PriceQueryException.permanent("Product id is blank");
        }
        if (properties.getPricing().getApiUrl() == null) {
            throw PriceQueryException.transientFailure("Pricing API url not configured");
        }
        return HttpUrl.get(properties.getPricing().getApiUrl().toString())
                .newBuilder()
                .addPathSegment("products")
                .addPathSegment(productId.trim())
                .addQueryParameter("region", region.name())
                .build();
    }
}
