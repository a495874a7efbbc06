package com.taodividends.backend.cache;

import com.taodividends.backend.model.DividendQuery;

public final class DividendFingerprint {

    private static final String PREFIX = "tao_dividends";

    private DividendFingerprint() {
    }

    public static String of(DividendQuery query) {
        return PREFIX + ":" + query.netuid() + ":" + query.hotkey();
    }
}
