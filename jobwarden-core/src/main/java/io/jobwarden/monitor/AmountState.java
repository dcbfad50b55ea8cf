package io.jobwarden.monitor;

import java.util.Locale;

public enum AmountState {
    OK,
    WARNING,
    CRITICAL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
