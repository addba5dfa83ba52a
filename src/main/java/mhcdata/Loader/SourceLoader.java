/*
 * Copyright 2016-2019 The Hong Kong University of Science and Technology
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package mhcdata.Loader;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multimap;
import mhcdata.Allele.AlleleNormalizer;
import mhcdata.Allele.AlleleParse;
import mhcdata.Types.Diagnostics;
import mhcdata.Types.MeasurementRecord;
import mhcdata.Types.SourceBatch;
import mhcdata.Types.SourceKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Loads one input file of one source into standardized records. Subclasses do the loading in their constructor;
 * the results are available from {@link #getRecordList()} and {@link #getDiagnostics()}.
 */
public abstract class SourceLoader {

    // the measurement assigned to qualitative "Positive" calls and mass-spec hits
    public static final double POSITIVE_AFFINITY = 500.0;

    protected final SourceKind kind;
    protected final String path;
    protected final AlleleNormalizer alleleNormalizer;
    protected final Diagnostics diagnostics;

    protected List<MeasurementRecord> recordList = new ArrayList<>();

    protected SourceLoader(SourceKind kind, String path, AlleleNormalizer alleleNormalizer) {
        this.kind = kind;
        this.path = path;
        this.alleleNormalizer = alleleNormalizer;
        diagnostics = new Diagnostics(kind.getSourceName(), path);
    }

    public List<MeasurementRecord> getRecordList() {
        return ImmutableList.copyOf(recordList);
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public SourceBatch toSourceBatch() {
        return new SourceBatch(kind, path, recordList);
    }

    /**
     * @return the canonical allele name, or null if the name cannot be parsed. Unparseable names go to the diagnostics.
     */
    protected String normalizeAllele(String rawAllele) {
        AlleleParse alleleParse = alleleNormalizer.parse(rawAllele);
        if (alleleParse.isCanonical()) {
            return alleleParse.getCanonicalName();
        }
        diagnostics.addUnparseableAllele(rawAllele);
        return null;
    }

    // keeps the first record of each (allele, peptide) pair
    static List<MeasurementRecord> dropDuplicatePairs(List<MeasurementRecord> inputList) {
        Multimap<String, String> allelePeptideMap = HashMultimap.create();
        List<MeasurementRecord> outputList = new ArrayList<>(inputList.size());
        for (MeasurementRecord record : inputList) {
            if (allelePeptideMap.put(record.allele, record.peptide)) {
                outputList.add(record);
            }
        }
        return outputList;
    }
}
