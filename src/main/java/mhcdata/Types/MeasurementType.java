package mhcdata.Types;

public enum MeasurementType {

    QUANTITATIVE("quantitative"), QUALITATIVE("qualitative");

    private final String label;

    MeasurementType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
