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

/**
 * Abelin et al. 2017 mono-allelic mass-spec hits (comma-separated: allele, peptide).
 */
public class AbelinMassSpecLoader extends SourceLoader {

    private static final Logger logger = LoggerFactory.getLogger(AbelinMassSpecLoader.class);

    public AbelinMassSpecLoader(String path, AlleleNormalizer alleleNormalizer) throws IOException {
        super(SourceKind.ABELIN_MASS_SPEC, path, alleleNormalizer);

        DelimitedTable table = new DelimitedTable(path, DelimitedTable.COMMA, 0);
        table.requireColumns("allele", "peptide");
        logger.info("Loaded Abelin mass-spec data: {} rows.", table.getRowList().size());

        List<MeasurementRecord> tempList = new ArrayList<>(table.getRowList().size());
        for (TableRow row : table.getRowList()) {
            String originalAllele = table.getString(row, "allele");
            String allele = normalizeAllele(originalAllele);
            if (allele != null) {
                tempList.add(new MeasurementRecord(allele, table.getString(row, "peptide"), POSITIVE_AFFINITY, MeasurementInequality.LESS, MeasurementType.QUALITATIVE, kind.getSourceName(), originalAllele));
            }
        }
        diagnostics.recordStage("drop unparseable alleles", table.getRowList().size(), tempList.size());

        recordList = dropDuplicatePairs(tempList);
        diagnostics.recordStage("drop duplicate allele-peptide pairs", tempList.size(), recordList.size());
    }
}
