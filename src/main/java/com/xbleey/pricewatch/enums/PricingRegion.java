package com.xbleey.pricewatch.enums;

import lombok.Getter;

@Getter
public enum PricingRegion {
    IT("amazon.it"),
    US("amazon.com"),
    UK("amazon.co.uk"),
    DE("amazon.de"),
    FR("amazon.fr"),
    ES("amazon.es"),
    CA("amazon.ca"),
    JP("amazon.co.jp"),
    AU("amazon.com.au");

    private final String domain;

    PricingRegion(String domain) {
        this.domain = domain;
    }

    public String productUrl(String productId, String affiliateTag) {
        String base = "https://www." + domain + "/dp/" + productId;
        if (affiliateTag == null || affiliateTag.isBlank()) {
            return base;
        }
        return base + "?tag=" + affiliateTag.trim();
    }
}
