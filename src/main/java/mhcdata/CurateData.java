package mhcdata;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import mhcdata.Allele.AlleleNormalizer;
import mhcdata.Allele.MhcAlleleNormalizer;
import mhcdata.Loader.*;
import mhcdata.Merge.Merger;
import mhcdata.Output.WriteCsv;
import mhcdata.Parameter.Parameter;
import mhcdata.Types.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * Filters and combines peptide-MHC affinity datasets (Kim 2014, IEDB, SysteMHC Atlas, Abelin 2017) into one
 * training table, optionally including peptides eluted and identified by mass-spec.
 */
public class CurateData {

    private static final Logger logger = LoggerFactory.getLogger(CurateData.class);
    public static final String versionStr = "1.0.0";

    public static void main(String[] args) {
        long startTime = System.nanoTime();

        CurateDataOptions options = new CurateDataOptions();
        JCommander jCommander = JCommander.newBuilder().addObject(options).programName("CurateData").build();
        try {
            jCommander.parse(args);
        } catch (ParameterException ex) {
            System.err.println(ex.getMessage());
            jCommander.usage();
            System.exit(1);
        }
        if (options.help) {
            jCommander.usage();
            return;
        }

        logger.info("Running CurateData version {}.", versionStr);

        try {
            Parameter parameter = new Parameter(options.parameterFile);
            for (Map.Entry<String, String> entry : parameter.returnParameterMap().entrySet()) {
                logger.info("{} = {}", entry.getKey(), entry.getValue());
            }

            CurationResult result = curate(options, parameter, new MhcAlleleNormalizer());
            for (Diagnostics diagnostics : result.diagnosticsList) {
                logDiagnostics(diagnostics);
            }

            new WriteCsv(options.outCsv, result.recordList);
        } catch (Exception ex) {
            logger.error("Curation failed, no output written.", ex);
            System.exit(1);
        }

        double totalMinute = (double) (System.nanoTime() - startTime) * 1e-9 / 60;
        logger.info("Running time: {} minutes.", String.format(Locale.US, "%.2f", totalMinute));
        logger.info("Done!");
    }

    /**
     * Loads every input file and merges them. Nothing is written; an I/O or schema error in any file aborts the run.
     */
    public static CurationResult curate(CurateDataOptions options, Parameter parameter, AlleleNormalizer alleleNormalizer) throws IOException {
        boolean includeQualitative = parameter.isIedbIncludeQualitative();
        double minProbability = parameter.getSystemhcAtlasMinProbability();

        List<SourceLoader> loaderList = new ArrayList<>();
        for (String path : options.iedbList) {
            logger.info("Loading IEDB data from {}...", path);
            loaderList.add(new IedbLoader(path, alleleNormalizer, includeQualitative, options.includeIedbMassSpec));
        }
        for (String path : options.kim2014List) {
            logger.info("Loading kim2014 data from {}...", path);
            loaderList.add(new Kim2014Loader(path, alleleNormalizer));
        }
        for (String path : options.systemhcAtlasList) {
            logger.info("Loading systemhc atlas data from {}...", path);
            loaderList.add(new SystemhcAtlasLoader(path, alleleNormalizer, minProbability));
        }
        for (String path : options.abelinMassSpecList) {
            logger.info("Loading Abelin mass-spec data from {}...", path);
            loaderList.add(new AbelinMassSpecLoader(path, alleleNormalizer));
        }

        List<SourceBatch> batchList = new ArrayList<>(loaderList.size());
        List<Diagnostics> diagnosticsList = new ArrayList<>(loaderList.size() + 1);
        for (SourceLoader loader : loaderList) {
            batchList.add(loader.toSourceBatch());
            diagnosticsList.add(loader.getDiagnostics());
        }

        logger.info("Merging {} data files...", batchList.size());
        Merger merger = new Merger(batchList);
        diagnosticsList.add(merger.getDiagnostics());

        return new CurationResult(merger.getRecordList(), diagnosticsList);
    }

    static void logDiagnostics(Diagnostics diagnostics) {
        String name = diagnostics.getPath() == null ? diagnostics.getSourceName() : diagnostics.getSourceName() + " (" + diagnostics.getPath() + ")";
        if (!diagnostics.getUnparseableAlleleSet().isEmpty()) {
            logger.warn("{}: dropping un-parseable alleles: {}", name, String.join(", ", diagnostics.getUnparseableAlleleSet()));
        }
        for (StageCount stageCount : diagnostics.getStageList()) {
            logger.info("{} {}: {} -> {}", name, stageCount.stage, stageCount.rowsBefore, stageCount.rowsAfter);
        }
        if (logger.isDebugEnabled()) {
            for (Map.Entry<String, ImmutableMultiset<String>> entry : diagnostics.getAlleleCountMap().entrySet()) {
                logger.debug("{} measurements per allele {}:", name, entry.getKey());
                for (Multiset.Entry<String> alleleCount : entry.getValue().entrySet()) {
                    logger.debug("{}\t{}", alleleCount.getElement(), alleleCount.getCount());
                }
            }
        }
    }
}
