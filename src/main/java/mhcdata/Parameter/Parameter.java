package mhcdata.Parameter;

import mhcdata.CurateData;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.*;

/**
 * Key-value parameters. The defaults come from the bundled curate_data.def; a user parameter file overrides them
 * key by key. Both files start with a "# version" line.
 */
public class Parameter {

    public static final String DEFAULT_RESOURCE = "curate_data.def";

    public static final String SYSTEMHC_ATLAS_MIN_PROBABILITY = "systemhc_atlas_min_probability";
    public static final String IEDB_INCLUDE_QUALITATIVE = "iedb_include_qualitative";

    private static final Pattern commentLinePattern = Pattern.compile("^#.*");
    private static final Pattern linePattern = Pattern.compile("([^#]+)=([^#]+)#*.*");

    private Map<String, String> parameterMap = new LinkedHashMap<>();

    public Parameter(String parameterFile) throws IOException {
        InputStream inputStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (inputStream == null) {
            throw new FileNotFoundException(String.format(Locale.US, "Cannot find the default parameter resource %s.", DEFAULT_RESOURCE));
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            readParameters(reader, DEFAULT_RESOURCE);
        }

        if (parameterFile != null) {
            File file = new File(parameterFile);
            if (!file.exists() || file.isDirectory()) {
                throw new FileNotFoundException(String.format(Locale.US, "Cannot find the parameter file %s.", parameterFile));
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8))) {
                readParameters(reader, parameterFile);
            }
        }
    }

    public Map<String, String> returnParameterMap() {
        return parameterMap;
    }

    public double getSystemhcAtlasMinProbability() {
        double minProbability = getDouble(SYSTEMHC_ATLAS_MIN_PROBABILITY);
        if (minProbability < 0 || minProbability > 1) {
            throw new IllegalArgumentException(String.format(Locale.US, "%s = %s is not in [0, 1].", SYSTEMHC_ATLAS_MIN_PROBABILITY, parameterMap.get(SYSTEMHC_ATLAS_MIN_PROBABILITY)));
        }
        return minProbability;
    }

    public boolean isIedbIncludeQualitative() {
        String value = getValue(IEDB_INCLUDE_QUALITATIVE);
        if (value.contentEquals("1")) {
            return true;
        } else if (value.contentEquals("0")) {
            return false;
        } else {
            throw new IllegalArgumentException(String.format(Locale.US, "%s = %s should be 0 or 1.", IEDB_INCLUDE_QUALITATIVE, value));
        }
    }

    private String getValue(String key) {
        String value = parameterMap.get(key);
        if (value == null) {
            throw new IllegalArgumentException(String.format(Locale.US, "Missing parameter %s.", key));
        }
        return value;
    }

    private double getDouble(String key) {
        String value = getValue(key);
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(String.format(Locale.US, "%s = %s is not a number.", key, value), ex);
        }
    }

    private void readParameters(BufferedReader reader, String name) throws IOException {
        String line = reader.readLine();
        if (line == null || !line.trim().contentEquals("# " + CurateData.versionStr)) {
            throw new IOException(String.format(Locale.US, "The parameter file %s (version line: %s) is not compatible with current version (%s).", name, line == null ? "" : line.trim(), CurateData.versionStr));
        }
        while ((line = reader.readLine()) != null) {
            line = line.trim();
            Matcher commentLineMatcher = commentLinePattern.matcher(line);
            if (!commentLineMatcher.matches()) {
                // This is not a comment line
                Matcher lineMatcher = linePattern.matcher(line);
                if (lineMatcher.matches()) {
                    String parameterName = lineMatcher.group(1).trim();
                    String parameterValue = lineMatcher.group(2).trim();
                    parameterMap.put(parameterName, parameterValue);
                }
            }
        }
    }
}
