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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;
import mhcdata.Allele.AlleleNormalizer;
import mhcdata.Table.DelimitedTable;
import mhcdata.Table.TableRow;
import mhcdata.Types.MeasurementInequality;
import mhcdata.Types.MeasurementRecord;
import mhcdata.Types.MeasurementType;
import mhcdata.Types.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;
import java.util.regex.Pattern;

/**
 * IEDB MHC ligand export (mhc_ligand_full.csv). The file has two header lines; the first one is skipped.
 * <p>
 * Rows go through a fixed sequence of steps. The order matters because later steps read the fields set by earlier
 * ones: class I selection, allele blacklist, mutant/CD1 removal, allele normalization, the quantitative/qualitative
 * split, mass-spec removal, the qualitative lookup, peptide validation, and finally the source annotation and
 * full-row deduplication.
 */
public class IedbLoader extends SourceLoader {

    private static final Logger logger = LoggerFactory.getLogger(IedbLoader.class);

    static final String CLASS_COLUMN = "MHC allele class";
    static final String ALLELE_COLUMN = "Allele Name";
    static final String UNITS_COLUMN = "Units";
    static final String QUALITATIVE_COLUMN = "Qualitative Measure";
    static final String QUANTITATIVE_COLUMN = "Quantitative measurement";
    static final String METHOD_COLUMN = "Method/Technique";
    static final String DESCRIPTION_COLUMN = "Description";
    static final String AUTHORS_COLUMN = "Authors";

    public static final Set<String> excludedAlleleSet = Collections.unmodifiableSet(new HashSet<>(Arrays.asList("HLA class I", "HLA class II")));

    public static final Map<String, Qualitative> qualitativeMap = ImmutableMap.<String, Qualitative>builder()
            .put("Negative", new Qualitative(5000.0, MeasurementInequality.GREATER))
            .put("Positive", new Qualitative(POSITIVE_AFFINITY, MeasurementInequality.LESS))
            .put("Positive-High", new Qualitative(100.0, MeasurementInequality.LESS))
            .put("Positive-Intermediate", new Qualitative(1000.0, MeasurementInequality.LESS))
            .put("Positive-Low", new Qualitative(5000.0, MeasurementInequality.LESS))
            .build();

    private static final Pattern whitespacePattern = Pattern.compile("\\s+");

    public IedbLoader(String path, AlleleNormalizer alleleNormalizer, boolean includeQualitative, boolean includeMassSpec) throws IOException {
        super(SourceKind.IEDB, path, alleleNormalizer);

        DelimitedTable table = new DelimitedTable(path, DelimitedTable.COMMA, 1);
        table.requireColumns(CLASS_COLUMN, ALLELE_COLUMN, UNITS_COLUMN, QUALITATIVE_COLUMN, QUANTITATIVE_COLUMN, METHOD_COLUMN, DESCRIPTION_COLUMN, AUTHORS_COLUMN);
        logger.info("Loaded iedb data: {} rows.", table.getRowList().size());

        List<IedbRow> rowList = new ArrayList<>(table.getRowList().size());
        for (TableRow row : table.getRowList()) {
            rowList.add(new IedbRow(table, row));
        }

        rowList = step("select class I", rowList, selectClassI(rowList));
        rowList = step("drop known unusable alleles", rowList, dropExcludedAlleles(rowList));
        rowList = step("drop mutant and CD1 alleles", rowList, dropMutantAndCd1(rowList));
        rowList = step("drop unparseable alleles", rowList, normalizeAlleles(rowList));
        diagnostics.recordAlleleCounts("after allele normalization", countAlleles(rowList));

        List<IedbRow> quantitativeList = toQuantitative(rowList);
        List<IedbRow> qualitativeList = toQualitative(rowList);
        diagnostics.recordStage("quantitative measurements", rowList.size(), quantitativeList.size());
        diagnostics.recordStage("qualitative measurements", rowList.size(), qualitativeList.size());
        if (!includeMassSpec) {
            qualitativeList = step("drop qualitative mass-spec", qualitativeList, dropMassSpec(qualitativeList));
        }
        qualitativeList = mapQualitative(qualitativeList);

        List<IedbRow> combinedList = new ArrayList<>(quantitativeList);
        if (includeQualitative) {
            combinedList.addAll(qualitativeList);
        }
        diagnostics.recordStage("combine quantitative and qualitative", quantitativeList.size() + qualitativeList.size(), combinedList.size());
        diagnostics.recordAlleleCounts("after combining", countAlleles(combinedList));

        combinedList = step("select valid peptides", combinedList, selectValidPeptides(combinedList));

        List<MeasurementRecord> tempList = toRecords(combinedList);
        recordList = new ArrayList<>(new LinkedHashSet<>(tempList));
        diagnostics.recordStage("drop duplicate rows", tempList.size(), recordList.size());
    }

    private List<IedbRow> step(String stage, List<IedbRow> inputList, List<IedbRow> outputList) {
        diagnostics.recordStage(stage, inputList.size(), outputList.size());
        logger.debug("{}: {} -> {}", stage, inputList.size(), outputList.size());
        return outputList;
    }

    static List<IedbRow> selectClassI(List<IedbRow> inputList) {
        List<IedbRow> outputList = new ArrayList<>(inputList.size());
        for (IedbRow row : inputList) {
            if (row.mhcClass != null && row.mhcClass.trim().toUpperCase(Locale.US).contentEquals("I")) {
                outputList.add(row);
            }
        }
        return outputList;
    }

    static List<IedbRow> dropExcludedAlleles(List<IedbRow> inputList) {
        List<IedbRow> outputList = new ArrayList<>(inputList.size());
        for (IedbRow row : inputList) {
            if (!excludedAlleleSet.contains(row.alleleName)) {
                outputList.add(row);
            }
        }
        return outputList;
    }

    static List<IedbRow> dropMutantAndCd1(List<IedbRow> inputList) {
        List<IedbRow> outputList = new ArrayList<>(inputList.size());
        for (IedbRow row : inputList) {
            if (row.alleleName == null || (!row.alleleName.contains("mutant") && !row.alleleName.contains("CD1"))) {
                outputList.add(row);
            }
        }
        return outputList;
    }

    private List<IedbRow> normalizeAlleles(List<IedbRow> inputList) {
        List<IedbRow> outputList = new ArrayList<>(inputList.size());
        for (IedbRow row : inputList) {
            String allele = normalizeAllele(row.alleleName);
            if (allele != null) {
                outputList.add(row.withAllele(allele));
            }
        }
        return outputList;
    }

    private static List<IedbRow> toQuantitative(List<IedbRow> inputList) throws IOException {
        List<IedbRow> outputList = new ArrayList<>();
        for (IedbRow row : inputList) {
            if ("nM".equals(row.units)) {
                outputList.add(row.withMeasurement(MeasurementType.QUANTITATIVE, row.getQuantitativeMeasurement(), MeasurementInequality.EQUAL));
            }
        }
        return outputList;
    }

    private static List<IedbRow> toQualitative(List<IedbRow> inputList) {
        List<IedbRow> outputList = new ArrayList<>();
        for (IedbRow row : inputList) {
            if (!"nM".equals(row.units)) {
                outputList.add(row.withMeasurement(MeasurementType.QUALITATIVE, null, null));
            }
        }
        return outputList;
    }

    static List<IedbRow> dropMassSpec(List<IedbRow> inputList) {
        List<IedbRow> outputList = new ArrayList<>(inputList.size());
        for (IedbRow row : inputList) {
            if (row.method == null || !row.method.contains("mass spec")) {
                outputList.add(row);
            }
        }
        return outputList;
    }

    // an unmapped category leaves value and inequality empty; the merger drops such rows.
    static List<IedbRow> mapQualitative(List<IedbRow> inputList) {
        List<IedbRow> outputList = new ArrayList<>(inputList.size());
        for (IedbRow row : inputList) {
            Qualitative qualitative = row.qualitativeMeasure == null ? null : qualitativeMap.get(row.qualitativeMeasure);
            if (qualitative == null) {
                outputList.add(row.withMeasurement(row.measurementType, null, null));
            } else {
                outputList.add(row.withMeasurement(row.measurementType, qualitative.affinity, qualitative.inequality));
            }
        }
        return outputList;
    }

    static List<IedbRow> selectValidPeptides(List<IedbRow> inputList) {
        List<IedbRow> outputList = new ArrayList<>(inputList.size());
        for (IedbRow row : inputList) {
            if (row.description != null && MeasurementRecord.peptidePattern.matcher(row.description.trim()).matches()) {
                outputList.add(row);
            }
        }
        return outputList;
    }

    private static List<MeasurementRecord> toRecords(List<IedbRow> inputList) {
        List<MeasurementRecord> outputList = new ArrayList<>(inputList.size());
        for (IedbRow row : inputList) {
            String lastAuthor = getLastAuthor(row.authors);
            String category = (lastAuthor == null || row.method == null) ? null : lastAuthor + " - " + row.method;
            outputList.add(new MeasurementRecord(row.allele, row.description.trim(), row.measurementValue, row.measurementInequality, row.measurementType, category, row.alleleName));
        }
        return outputList;
    }

    /**
     * The last whitespace-separated token of the last author, without "*". "Carla Oseroff; John Sidney; Alessandro
     * Sette*" gives "Sette".
     */
    public static String getLastAuthor(String authors) {
        if (authors == null) {
            return null;
        }
        String[] authorArray = authors.split(";", -1);
        String[] nameArray = authorArray[authorArray.length - 1].split(",", -1);
        String[] tokenArray = whitespacePattern.split(nameArray[nameArray.length - 1].trim(), -1);
        return tokenArray[tokenArray.length - 1].trim().replace("*", "");
    }

    private static Multiset<String> countAlleles(List<IedbRow> rowList) {
        Multiset<String> alleleCounts = HashMultiset.create();
        for (IedbRow row : rowList) {
            alleleCounts.add(row.allele);
        }
        return alleleCounts;
    }

    public static class Qualitative {

        public final double affinity;
        public final MeasurementInequality inequality;

        Qualitative(double affinity, MeasurementInequality inequality) {
            this.affinity = affinity;
            this.inequality = inequality;
        }
    }

    static final class IedbRow {

        final String path;
        final int lineNum;
        final String mhcClass;
        final String alleleName;
        final String units;
        final String qualitativeMeasure;
        final String quantitativeMeasurement;
        final String method;
        final String description;
        final String authors;

        // derived
        final String allele;
        final MeasurementType measurementType;
        final Double measurementValue;
        final MeasurementInequality measurementInequality;

        IedbRow(DelimitedTable table, TableRow row) throws IOException {
            this(table.getPath(), row.lineNum, table.getString(row, CLASS_COLUMN), table.getString(row, ALLELE_COLUMN), table.getString(row, UNITS_COLUMN), table.getString(row, QUALITATIVE_COLUMN), table.getString(row, QUANTITATIVE_COLUMN), table.getString(row, METHOD_COLUMN), table.getString(row, DESCRIPTION_COLUMN), table.getString(row, AUTHORS_COLUMN), null, null, null, null);
        }

        IedbRow(String path, int lineNum, String mhcClass, String alleleName, String units, String qualitativeMeasure, String quantitativeMeasurement, String method, String description, String authors, String allele, MeasurementType measurementType, Double measurementValue, MeasurementInequality measurementInequality) {
            this.path = path;
            this.lineNum = lineNum;
            this.mhcClass = mhcClass;
            this.alleleName = alleleName;
            this.units = units;
            this.qualitativeMeasure = qualitativeMeasure;
            this.quantitativeMeasurement = quantitativeMeasurement;
            this.method = method;
            this.description = description;
            this.authors = authors;
            this.allele = allele;
            this.measurementType = measurementType;
            this.measurementValue = measurementValue;
            this.measurementInequality = measurementInequality;
        }

        IedbRow withAllele(String allele) {
            return new IedbRow(path, lineNum, mhcClass, alleleName, units, qualitativeMeasure, quantitativeMeasurement, method, description, authors, allele, measurementType, measurementValue, measurementInequality);
        }

        IedbRow withMeasurement(MeasurementType measurementType, Double measurementValue, MeasurementInequality measurementInequality) {
            return new IedbRow(path, lineNum, mhcClass, alleleName, units, qualitativeMeasure, quantitativeMeasurement, method, description, authors, allele, measurementType, measurementValue, measurementInequality);
        }

        Double getQuantitativeMeasurement() throws IOException {
            if (quantitativeMeasurement == null || quantitativeMeasurement.trim().isEmpty()) {
                return null;
            }
            try {
                return Double.valueOf(quantitativeMeasurement.trim());
            } catch (NumberFormatException ex) {
                throw new IOException(String.format(Locale.US, "%s line %d: the %s value (%s) is not a number.", path, lineNum, QUANTITATIVE_COLUMN, quantitativeMeasurement), ex);
            }
        }
    }
}
