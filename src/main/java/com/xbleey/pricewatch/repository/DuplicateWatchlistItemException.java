package com.xbleey.pricewatch.repository;

public class DuplicateWatchlistItemException extends RuntimeException {

    public DuplicateWatchlistItemException(String ownerId, String productId) {
        super("Owner " + ownerId + " already watches product " + productId);
    }
}
