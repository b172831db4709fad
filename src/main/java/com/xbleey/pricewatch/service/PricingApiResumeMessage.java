package com.xbleey.pricewatch.service;

import java.time.Duration;
import java.time.Instant;

public record PricingApiResumeMessage(Instant resumeTime, Instant firstFailureTime, Duration downtime, String apiUrl) {
}
