package com.phillippitts.cipherseal.domain;

/** Expected outcomes of an embed operation. Unexpected faults are exceptions, not statuses. */
public enum EmbedStatus {
    /** The full delimiter-terminated payload was written and the output persisted. */
    EMBEDDED,
    /** The payload needs more bit slots than the carrier offers; nothing was written. */
    INSUFFICIENT_CAPACITY,
    /** The input file does not exist. */
    SOURCE_NOT_FOUND
}
