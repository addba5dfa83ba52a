package mhcdata.Types;

import com.google.common.collect.ImmutableList;

import java.util.List;

public class CurationResult {

    public final ImmutableList<MeasurementRecord> recordList;
    public final ImmutableList<Diagnostics> diagnosticsList;

    public CurationResult(List<MeasurementRecord> recordList, List<Diagnostics> diagnosticsList) {
        this.recordList = ImmutableList.copyOf(recordList);
        this.diagnosticsList = ImmutableList.copyOf(diagnosticsList);
    }
}
