package mhcdata.Types;

import com.google.common.collect.ImmutableList;

import java.util.List;

public class SourceBatch {

    public final SourceKind kind;
    public final String path;
    public final ImmutableList<MeasurementRecord> recordList;

    public SourceBatch(SourceKind kind, String path, List<MeasurementRecord> recordList) {
        this.kind = kind;
        this.path = path;
        this.recordList = ImmutableList.copyOf(recordList);
    }
}
