package mhcdata.Loader;

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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * SysteMHC Atlas mass-spec hits (comma-separated: top_allele, search_hit, prob). Every hit above the probability
 * threshold is a qualitative positive.
 */
public class SystemhcAtlasLoader extends SourceLoader {

    private static final Logger logger = LoggerFactory.getLogger(SystemhcAtlasLoader.class);

    public static final double DEFAULT_MIN_PROBABILITY = 0.99;

    public SystemhcAtlasLoader(String path, AlleleNormalizer alleleNormalizer, double minProbability) throws IOException {
        super(SourceKind.SYSTEMHC_ATLAS, path, alleleNormalizer);

        DelimitedTable table = new DelimitedTable(path, DelimitedTable.COMMA, 0);
        table.requireColumns("top_allele", "search_hit", "prob");
        logger.info("Loaded systemhc atlas data: {} rows.", table.getRowList().size());

        List<TableRow> rowList = new ArrayList<>(table.getRowList().size());
        List<MeasurementRecord> tempList = new ArrayList<>(table.getRowList().size());
        for (TableRow row : table.getRowList()) {
            String topAllele = table.getString(row, "top_allele");
            String allele = normalizeAllele(topAllele);
            if (allele != null) {
                rowList.add(row);
                tempList.add(new MeasurementRecord(allele, table.getString(row, "search_hit"), POSITIVE_AFFINITY, MeasurementInequality.LESS, MeasurementType.QUALITATIVE, kind.getSourceName(), topAllele));
            }
        }
        diagnostics.recordStage("drop unparseable alleles", table.getRowList().size(), tempList.size());

        logger.debug("Dropping data points with probability < {}.", minProbability);
        List<MeasurementRecord> probableList = new ArrayList<>(tempList.size());
        for (int i = 0; i < rowList.size(); ++i) {
            Double prob = table.getDouble(rowList.get(i), "prob");
            if (prob != null && prob >= minProbability) {
                probableList.add(tempList.get(i));
            }
        }
        diagnostics.recordStage(String.format(Locale.US, "drop probability < %s", minProbability), tempList.size(), probableList.size());

        recordList = dropDuplicatePairs(probableList);
        diagnostics.recordStage("drop duplicate allele-peptide pairs", probableList.size(), recordList.size());
    }
}
