package mhcdata;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.converters.IParameterSplitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CurateDataOptions {

    @Parameter(names = "--data-kim2014", description = "Path to Kim 2014-style affinity data (repeatable)", splitter = PathSplitter.class) public List<String> kim2014List = new ArrayList<>();
    @Parameter(names = "--data-iedb", description = "Path to IEDB-style affinity data, e.g. mhc_ligand_full.csv (repeatable)", splitter = PathSplitter.class) public List<String> iedbList = new ArrayList<>();
    @Parameter(names = "--data-systemhc-atlas", description = "Path to SysteMHC Atlas-style mass-spec data (repeatable)", splitter = PathSplitter.class) public List<String> systemhcAtlasList = new ArrayList<>();
    @Parameter(names = "--data-abelin-mass-spec", description = "Path to Abelin Immunity 2017 mass-spec hits (repeatable)", splitter = PathSplitter.class) public List<String> abelinMassSpecList = new ArrayList<>();
    @Parameter(names = "--include-iedb-mass-spec", description = "Include mass-spec observations in IEDB") public boolean includeIedbMassSpec = false;
    @Parameter(names = "--out-csv", description = "Result file", required = true) public String outCsv;
    @Parameter(names = "--parameter-file", description = "Parameter file overriding the bundled defaults") public String parameterFile;
    @Parameter(names = {"-h", "--help"}, description = "Print this help", help = true) public boolean help = false;

    // a path is never split on commas
    public static class PathSplitter implements IParameterSplitter {

        public List<String> split(String value) {
            return Collections.singletonList(value);
        }
    }
}
