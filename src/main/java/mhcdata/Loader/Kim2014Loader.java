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
 * Kim et al. 2014 benchmark affinities (tab-separated: mhc, sequence, meas, inequality).
 */
public class Kim2014Loader extends SourceLoader {

    private static final Logger logger = LoggerFactory.getLogger(Kim2014Loader.class);

    public Kim2014Loader(String path, AlleleNormalizer alleleNormalizer) throws IOException {
        super(SourceKind.KIM2014, path, alleleNormalizer);

        DelimitedTable table = new DelimitedTable(path, DelimitedTable.TAB, 0);
        table.requireColumns("mhc", "sequence", "meas", "inequality");
        logger.info("Loaded kim2014 data: {} rows.", table.getRowList().size());

        List<MeasurementRecord> tempList = new ArrayList<>(table.getRowList().size());
        for (TableRow row : table.getRowList()) {
            String mhc = table.getString(row, "mhc");
            String allele = normalizeAllele(mhc);
            if (allele == null) {
                continue;
            }
            String inequality = table.getString(row, "inequality");
            MeasurementType measurementType = "=".equals(inequality) ? MeasurementType.QUANTITATIVE : MeasurementType.QUALITATIVE;
            tempList.add(new MeasurementRecord(allele, table.getString(row, "sequence"), table.getDouble(row, "meas"), MeasurementInequality.fromSymbol(inequality), measurementType, kind.getSourceName(), mhc));
        }
        diagnostics.recordStage("drop unparseable alleles", table.getRowList().size(), tempList.size());

        recordList = tempList;
    }
}
