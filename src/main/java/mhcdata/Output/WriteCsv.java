package mhcdata.Output;

import mhcdata.Types.MeasurementRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.List;
import java.util.Locale;

public class WriteCsv {

    private static final Logger logger = LoggerFactory.getLogger(WriteCsv.class);

    public static final String HEADER = "allele,peptide,measurement_value,measurement_inequality,measurement_type,measurement_source,original_allele";

    public WriteCsv(String outputPath, List<MeasurementRecord> recordList) throws IOException {
        Path targetPath = Paths.get(outputPath).toAbsolutePath();
        Path parentPath = targetPath.getParent();
        if (parentPath != null && !Files.isDirectory(parentPath)) {
            throw new FileNotFoundException(String.format(Locale.US, "The output directory %s doesn't exist.", parentPath));
        }

        // written next to the target and moved at the end so that a failed run leaves no partial file
        Path tempPath = Files.createTempFile(parentPath, targetPath.getFileName().toString() + ".", ".temp");
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
                writer.write(HEADER + "\n");
                for (MeasurementRecord record : recordList) {
                    writer.write(toLine(record));
                }
            }
            try {
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tempPath);
        }

        logger.info("Wrote {} records to {}.", recordList.size(), targetPath);
    }

    static String toLine(MeasurementRecord record) {
        return escape(record.allele) + ","
                + escape(record.peptide) + ","
                + record.measurementValue + ","
                + record.measurementInequality.getSymbol() + ","
                + record.measurementType.getLabel() + ","
                + escape(record.measurementSource) + ","
                + escape(record.originalAllele) + "\n";
    }

    static String escape(String field) {
        if (field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r")) {
            return "\"" + field.replace("\"", "\"\"") + "\"";
        }
        return field;
    }
}
