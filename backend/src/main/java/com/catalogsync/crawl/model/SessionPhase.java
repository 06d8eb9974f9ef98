package com.catalogsync.crawl.model;

import java.util.Locale;

/**
 * Advisory progress label shown next to the status.
 */
public enum SessionPhase {
    COLLECTING_URLS,
    AWAITING_CONFIRMATION,
    PARSING_PRODUCTS,
    DONE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
