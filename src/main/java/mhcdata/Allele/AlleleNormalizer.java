package mhcdata.Allele;

public interface AlleleNormalizer {

    /**
     * Never throws. Parse failures come back as {@link AlleleParse#unparseable(String)}.
     */
    AlleleParse parse(String rawName);

    /**
     * @return the canonical allele name, or "UNKNOWN" if it cannot be parsed.
     */
    default String normalize(String rawName) {
        return parse(rawName).toAlleleString();
    }
}
