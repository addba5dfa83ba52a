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

package mhcdata.Merge;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multimap;
import com.google.common.collect.Table;
import mhcdata.Types.Diagnostics;
import mhcdata.Types.MeasurementRecord;
import mhcdata.Types.SourceBatch;
import mhcdata.Types.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Combines the loaded batches into the final table.
 * <p>
 * Batches are ordered by {@link SourceKind} precedence (IEDB, Kim2014, SystemHC-Atlas, Abelin); batches of the same
 * kind keep their given order. Kim2014 records whose allele-peptide pair is present in any IEDB batch are dropped.
 * The batches are then concatenated and only the first record of each (allele, peptide, measurement value) triple is
 * kept. Finally the records are sorted by allele and peptide, and records with a missing field, an unknown allele or
 * an invalid peptide are dropped.
 */
public class Merger {

    private static final Logger logger = LoggerFactory.getLogger(Merger.class);

    public static final String SOURCE_NAME = "merge";

    public static final Comparator<MeasurementRecord> allelePeptideComparator = Comparator.comparing((MeasurementRecord record) -> record.allele, Comparator.nullsLast(Comparator.<String>naturalOrder())).thenComparing(record -> record.peptide, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final Diagnostics diagnostics = new Diagnostics(SOURCE_NAME, null);
    private final List<MeasurementRecord> recordList;

    public Merger(List<SourceBatch> batchList) {
        List<SourceBatch> orderedBatchList = new ArrayList<>(batchList);
        orderedBatchList.sort(Comparator.comparingInt(batch -> batch.kind.ordinal()));

        Multimap<String, String> iedbPairMap = HashMultimap.create();
        boolean hasIedb = false;
        for (SourceBatch batch : orderedBatchList) {
            if (batch.kind == SourceKind.IEDB) {
                hasIedb = true;
                for (MeasurementRecord record : batch.recordList) {
                    iedbPairMap.put(record.allele, record.peptide);
                }
            }
        }

        List<MeasurementRecord> combinedList = new ArrayList<>();
        for (SourceBatch batch : orderedBatchList) {
            if (batch.kind == SourceKind.KIM2014 && hasIedb) {
                List<MeasurementRecord> keptList = dropIedbPairs(batch.recordList, iedbPairMap);
                diagnostics.recordStage("drop kim2014 pairs present in IEDB (" + batch.path + ")", batch.recordList.size(), keptList.size());
                combinedList.addAll(keptList);
            } else {
                combinedList.addAll(batch.recordList);
            }
        }
        logger.debug("Combined {} batches into {} records.", orderedBatchList.size(), combinedList.size());

        List<MeasurementRecord> distinctList = dropDuplicateMeasurements(combinedList);
        diagnostics.recordStage("drop duplicate allele-peptide-value triples", combinedList.size(), distinctList.size());

        List<MeasurementRecord> sortedList = new ArrayList<>(distinctList);
        sortedList.sort(allelePeptideComparator);

        List<MeasurementRecord> completeList = new ArrayList<>(sortedList.size());
        for (MeasurementRecord record : sortedList) {
            if (!record.hasMissingField()) {
                completeList.add(record);
            }
        }
        diagnostics.recordStage("drop records with missing fields", sortedList.size(), completeList.size());

        List<MeasurementRecord> validList = new ArrayList<>(completeList.size());
        for (MeasurementRecord record : completeList) {
            if (record.hasKnownAllele() && record.hasValidPeptide()) {
                validList.add(record);
            }
        }
        diagnostics.recordStage("drop unknown alleles and invalid peptides", completeList.size(), validList.size());

        recordList = validList;
    }

    public List<MeasurementRecord> getRecordList() {
        return ImmutableList.copyOf(recordList);
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    static List<MeasurementRecord> dropIedbPairs(List<MeasurementRecord> inputList, Multimap<String, String> iedbPairMap) {
        List<MeasurementRecord> outputList = new ArrayList<>(inputList.size());
        for (MeasurementRecord record : inputList) {
            if (!iedbPairMap.containsEntry(record.allele, record.peptide)) {
                outputList.add(record);
            }
        }
        return outputList;
    }

    // keep-first on (allele, peptide, measurement value); a missing value counts as a value of its own
    static List<MeasurementRecord> dropDuplicateMeasurements(List<MeasurementRecord> inputList) {
        Table<String, String, Set<Double>> seenTable = HashBasedTable.create();
        List<MeasurementRecord> outputList = new ArrayList<>(inputList.size());
        for (MeasurementRecord record : inputList) {
            String allele = String.valueOf(record.allele);
            String peptide = String.valueOf(record.peptide);
            Set<Double> valueSet = seenTable.get(allele, peptide);
            if (valueSet == null) {
                valueSet = new HashSet<>();
                seenTable.put(allele, peptide, valueSet);
            }
            if (valueSet.add(record.measurementValue)) {
                outputList.add(record);
            }
        }
        return outputList;
    }
}
