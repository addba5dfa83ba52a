package mhcdata.Types;

/**
 * Data sources in merge precedence order. Earlier kinds are concatenated first, so they win the keep-first
 * deduplication of the merged table.
 */
public enum SourceKind {

    IEDB("iedb"), KIM2014("kim2014"), SYSTEMHC_ATLAS("systemhc-atlas"), ABELIN_MASS_SPEC("abelin-mass-spec");

    private final String sourceName;

    SourceKind(String sourceName) {
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
