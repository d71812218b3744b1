package com.envelope.backend.enums;

public enum TargetCadence {
    MONTHLY,
    YEARLY,
    CUSTOM
}
