package io.hhplus.shop.application.cache;

public final class CacheNames {

    public static final String QUERIES = "queries";

    private CacheNames() {
    }
}
