package com.oceanintel.argo.service;

/**
 * Argo reference table 2 quality flags.
 *
 *   0 no QC performed        5 value changed
 *   1 good                   8 estimated
 *   2 probably good          9 missing
 *   3 probably bad           ' ' fill
 *   4 bad
 */
public final class QcFlags {

    public static final char GOOD = '1';
    public static final char PROBABLY_GOOD = '2';
    public static final char MISSING = '9';

    private QcFlags() {
    }

    public static boolean isAccepted(char flag) {
        return flag == GOOD || flag == PROBABLY_GOOD;
    }

    /**
     * Combined flag of several variables at one level: the weaker of the accepted
     * flags when all are accepted, otherwise the first flag that is not.
     */
    public static char combine(char... flags) {
        char combined = GOOD;
        for (char flag : flags) {
            if (!isAccepted(flag)) {
                return normalise(flag);
            }
            if (flag == PROBABLY_GOOD) {
                combined = PROBABLY_GOOD;
            }
        }
        return combined;
    }

    /** Blank and NUL fill characters read as "missing". */
    public static char normalise(char flag) {
        return (flag == ' ' || flag == '\0') ? MISSING : flag;
    }
}
