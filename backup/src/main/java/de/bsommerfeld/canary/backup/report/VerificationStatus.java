package de.bsommerfeld.canary.backup.report;

/** Outcome of one backup in a batch run. */
public enum VerificationStatus {
    PASS,
    FAIL,
    /** The verification itself crashed; the backup state is unknown. */
    ERROR
}
