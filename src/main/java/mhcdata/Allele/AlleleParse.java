package mhcdata.Allele;

import mhcdata.Types.MeasurementRecord;

import java.util.Locale;

/**
 * Outcome of parsing a raw allele name: either a canonical name or the raw text that could not be parsed.
 */
public final class AlleleParse {

    private final String canonicalName;
    private final String rawName;

    private AlleleParse(String canonicalName, String rawName) {
        this.canonicalName = canonicalName;
        this.rawName = rawName;
    }

    public static AlleleParse canonical(String canonicalName, String rawName) {
        return new AlleleParse(canonicalName, rawName);
    }

    public static AlleleParse unparseable(String rawName) {
        return new AlleleParse(null, rawName);
    }

    public boolean isCanonical() {
        return canonicalName != null;
    }

    public String getCanonicalName() {
        if (canonicalName == null) {
            throw new IllegalStateException(String.format(Locale.US, "Allele name %s is not parseable.", rawName));
        }
        return canonicalName;
    }

    public String getRawName() {
        return rawName;
    }

    // the sentinel form used by the output table
    public String toAlleleString() {
        return canonicalName == null ? MeasurementRecord.UNKNOWN_ALLELE : canonicalName;
    }

    public String toString() {
        return isCanonical() ? "Canonical(" + canonicalName + ")" : "Unparseable(" + rawName + ")";
    }
}
