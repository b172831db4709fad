package com.xbleey.pricewatch.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "pricewatch.alert.mail")
public class PriceWatchMailProperties {

    private String sender;
    private List<String> recipients = new ArrayList<>();
    private Duration errorNotifyInterval = Duration.ofMinutes(10);

    @PostConstruct
    public void validate() {
        if (errorNotifyInterval == null || errorNotifyInterval.isNegative()) {
            throw new IllegalStateException("pricewatch.alert.mail.error-notify-interval must be >= 0");
        }
    }
}
