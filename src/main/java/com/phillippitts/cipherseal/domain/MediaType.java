package com.phillippitts.cipherseal.domain;

import java.util.Locale;

/** Kind of carrier a watermark is embedded into. */
public enum MediaType {
    IMAGE,
    TEXT;

    /** Lowercase name used in metric tags, log lines and operation names. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
