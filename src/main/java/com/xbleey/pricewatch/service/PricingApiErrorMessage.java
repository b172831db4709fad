package com.xbleey.pricewatch.service;

import java.time.Duration;
import java.time.Instant;

public record PricingApiErrorMessage(Instant failureTime, String apiUrl, String errorDetail, Duration downtime) {
}
