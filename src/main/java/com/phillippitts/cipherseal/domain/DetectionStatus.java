package com.phillippitts.cipherseal.domain;

/** Expected outcomes of a detection. */
public enum DetectionStatus {
    DETECTED,
    NOT_DETECTED,
    SOURCE_NOT_FOUND
}
