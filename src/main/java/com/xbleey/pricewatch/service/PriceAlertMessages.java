package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.config.PriceWatchProperties;
import com.xbleey.pricewatch.enums.PricingRegion;
import com.xbleey.pricewatch.model.NotificationEvent;
import com.xbleey.pricewatch.model.WatchlistItem;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Owner-facing message texts, in Telegram Markdown.
 */
@Component
public class PriceAlertMessages {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final PricingRegion region;
    private final String affiliateTag;

    public PriceAlertMessages(PriceWatchProperties properties) {
        this.region = properties.getPricing().getRegion() == null
                ? PricingRegion.IT
                : properties.getPricing().getRegion();
        this.affiliateTag = properties.getPricing().getAffiliateTag();
    }

    public String priceDrop(WatchlistItem item, NotificationEvent event) {
        BigDecimal reference = item.threshold();
        BigDecimal price = event.getPrice();
        String currency = currency(item);
        StringBuilder builder = new StringBuilder();
        builder.append("*Price drop!*").append('\n').append('\n');
        builder.append(escape(title(item))).append('\n');
        builder.append("Product: `").append(item.getProductId()).append('`').append('\n').append('\n');
        builder.append(item.hasTarget() ? "Target price: " : "Initial price: ")
                .append(formatPrice(reference)).append(' ').append(currency).append('\n');
        builder.append("*Current price:* ").append(formatPrice(price)).append(' ').append(currency).append('\n');
        if (reference != null && reference.compareTo(price) > 0) {
            builder.append("Saving: ").append(formatPrice(reference.subtract(price))).append(' ').append(currency)
                    .append(" (").append(formatPercent(reference, price)).append("%)").append('\n');
        }
        builder.append('\n').append("[Buy now](").append(productUrl(item)).append(')');
        return builder.toString();
    }

    public String permanentFailure(WatchlistItem item) {
        return "*Price tracking paused*" + '\n' + '\n'
                + escape(title(item)) + '\n'
                + "Product: `" + item.getProductId() + '`' + '\n' + '\n'
                + "The product can no longer be found, so its price is not checked anymore. "
                + "Remove it or add it again once it is available.";
    }

    public String dailySummary(List<WatchlistItem> items) {
        if (items == null || items.isEmpty()) {
            return "*Watchlist summary*" + '\n' + '\n' + "Your watchlist is empty.";
        }
        StringBuilder builder = new StringBuilder();
        builder.append("*Watchlist summary*").append('\n').append('\n');
        int index = 1;
        for (WatchlistItem item : items) {
            String currency = currency(item);
            BigDecimal initial = item.getInitialPrice();
            BigDecimal current = item.getCurrentPrice() == null ? initial : item.getCurrentPrice();
            builder.append(index).append(". *").append(escape(title(item))).append('*').append('\n');
            builder.append("   Product: `").append(item.getProductId()).append('`').append('\n');
            if (initial != null) {
                builder.append("   Initial price: ").append(formatPrice(initial)).append(' ').append(currency).append('\n');
            }
            if (current != null) {
                builder.append("   Last known price: ").append(formatPrice(current)).append(' ').append(currency).append('\n');
                if (initial != null && current.compareTo(initial) < 0) {
                    builder.append("   Down ").append(formatPrice(initial.subtract(current))).append(' ').append(currency)
                            .append(" (").append(formatPercent(initial, current)).append("%)").append('\n');
                }
            }
            builder.append("   [View](").append(productUrl(item)).append(')').append('\n').append('\n');
            index++;
        }
        return builder.toString().stripTrailing();
    }

    public String productUrl(WatchlistItem item) {
        return region.productUrl(item.getProductId(), affiliateTag);
    }

    private String title(WatchlistItem item) {
        String title = item.getTitle();
        return title == null || title.isBlank() ? "Product " + item.getProductId() : title;
    }

    private String currency(WatchlistItem item) {
        String currency = item.getCurrency();
        return currency == null || currency.isBlank() ? "EUR" : currency;
    }

    private static String formatPrice(BigDecimal price) {
        return price == null ? "-" : price.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String formatPercent(BigDecimal reference, BigDecimal price) {
        if (reference.signum() == 0) {
            return "0.0";
        }
        return reference.subtract(price)
                .multiply(ONE_HUNDRED)
                .divide(reference, 1, RoundingMode.HALF_UP)
                .toPlainString();
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\")
                .replace("_", "\\_")
                .replace("*", "\\*")
                .replace("`", "\\`")
                .replace("[", "\\[");
    }
}
