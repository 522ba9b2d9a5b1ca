package de.bsommerfeld.canary.restore;

import java.util.Locale;

public enum RestoreStatus {

    SUCCESS,
    FAILED,
    /** The operator declined the confirmation prompt; nothing was touched. */
    DECLINED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    static RestoreStatus fromLabel(String label) {
        return valueOf(label.toUpperCase(Locale.ROOT));
    }
}
