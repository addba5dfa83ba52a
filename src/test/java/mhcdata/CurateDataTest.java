package mhcdata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import mhcdata.Allele.MhcAlleleNormalizer;
import mhcdata.Loader.IedbTestFile;
import mhcdata.Merge.Merger;
import mhcdata.Parameter.Parameter;
import mhcdata.Types.CurationResult;
import mhcdata.Types.MeasurementRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CurateDataTest {

  @TempDir
  Path tempDir;

  private Path kimPath;
  private Path iedbPath;
  private Path systemhcPath;
  private Path abelinPath;

  @BeforeEach
  void writeFiles() throws IOException {
    kimPath = tempDir.resolve("bdata.20130222.mhci.public.1.txt");
    Files.write(kimPath, Arrays.asList(
        "mhc\tsequence\tmeas\tinequality",
        "HLA-A*02:01\tSLLMWITQC\t12.3\t=",
        "HLA-A*02:01\tKVAELVHFL\t20000\t>",
        "HLA-B*07:02\tRPPIFIRRL\t30.0\t=",
        "BAD ALLELE\tAAAAAAAAA\t10\t="), StandardCharsets.UTF_8);

    iedbPath = IedbTestFile.write(tempDir, "mhc_ligand_full.csv",
        IedbTestFile.row("Carla Oseroff; Alessandro Sette", "RPPIFIRRL", "purified MHC/competitive/radioactivity", "Positive", "nM", "5.5", "HLA-B*07:02", "I"),
        IedbTestFile.row("Carla Oseroff; Alessandro Sette", "SLLMWITQC", "purified MHC/competitive/radioactivity", "Positive", "nM", "1.0", "HLA-A*02:01", "II"),
        IedbTestFile.row("Carla Oseroff; Alessandro Sette", "KLIETYFSK", "purified MHC/direct/fluorescence", "Positive", null, null, "HLA-A*03:01", "I"));

    systemhcPath = tempDir.resolve("systemhc.csv");
    Files.write(systemhcPath, Arrays.asList(
        "top_allele,search_hit,prob",
        "HLA-A*02:01,GILGFVFTL,0.995",
        "HLA-A*02:01,NLVPMVATV,0.5",
        "HLA-A*02:01,GILGFVFTL,0.999"), StandardCharsets.UTF_8);

    abelinPath = tempDir.resolve("abelin2017.hits.csv");
    Files.write(abelinPath, Arrays.asList(
        "allele,peptide",
        "HLA-B*07:02,RPPIFIRRL",
        "HLA-B*07:02,APRTVALTA",
        "HLA-B*07:02,APRTVALTA"), StandardCharsets.UTF_8);
  }

  private CurateDataOptions parse(String... args) {
    CurateDataOptions options = new CurateDataOptions();
    JCommander.newBuilder().addObject(options).build().parse(args);
    return options;
  }

  private String[] allArgs(Path outPath) {
    return new String[]{
        "--data-kim2014", kimPath.toString(),
        "--data-iedb", iedbPath.toString(),
        "--data-systemhc-atlas", systemhcPath.toString(),
        "--data-abelin-mass-spec", abelinPath.toString(),
        "--out-csv", outPath.toString()};
  }

  @Test
  void testEndToEnd() throws IOException {
    Path outPath = tempDir.resolve("curated_training_data.csv");
    CurateData.main(allArgs(outPath));

    List<String> lineList = Files.readAllLines(outPath, StandardCharsets.UTF_8);
    assertEquals(Arrays.asList(
        "allele,peptide,measurement_value,measurement_inequality,measurement_type,measurement_source,original_allele",
        "HLA-A*02:01,GILGFVFTL,500.0,<,qualitative,systemhc-atlas,HLA-A*02:01",
        "HLA-A*02:01,KVAELVHFL,20000.0,>,qualitative,kim2014,HLA-A*02:01",
        "HLA-A*02:01,SLLMWITQC,12.3,=,quantitative,kim2014,HLA-A*02:01",
        "HLA-A*03:01,KLIETYFSK,500.0,<,qualitative,Sette - purified MHC/direct/fluorescence,HLA-A*03:01",
        "HLA-B*07:02,APRTVALTA,500.0,<,qualitative,abelin-mass-spec,HLA-B*07:02",
        "HLA-B*07:02,RPPIFIRRL,5.5,=,quantitative,Sette - purified MHC/competitive/radioactivity,HLA-B*07:02",
        "HLA-B*07:02,RPPIFIRRL,500.0,<,qualitative,abelin-mass-spec,HLA-B*07:02"), lineList);
  }

  @Test
  void testOutputInvariants() throws IOException {
    CurateDataOptions options = parse(allArgs(tempDir.resolve("out.csv")));
    CurationResult result = CurateData.curate(options, new Parameter(null), new MhcAlleleNormalizer());

    Set<String> tripleSet = new HashSet<>();
    MeasurementRecord lastRecord = null;
    for (MeasurementRecord record : result.recordList) {
      assertTrue(MeasurementRecord.peptidePattern.matcher(record.peptide).matches());
      assertNotEquals("UNKNOWN", record.allele);
      assertFalse(record.hasMissingField());
      assertTrue(tripleSet.add(record.allele + "_" + record.peptide + "_" + record.measurementValue));
      if (lastRecord != null) {
        assertTrue(Merger.allelePeptideComparator.compare(lastRecord, record) <= 0);
      }
      lastRecord = record;

      // IEDB wins over kim2014 for the same pair
      assertFalse(record.measurementSource.contentEquals("kim2014") && record.peptide.contentEquals("RPPIFIRRL"));
      // below the probability threshold
      assertFalse(record.peptide.contentEquals("NLVPMVATV"));
    }

    // four loaders and the merger
    assertEquals(5, result.diagnosticsList.size());
    assertTrue(result.diagnosticsList.get(1).getUnparseableAlleleSet().contains("BAD ALLELE"));
  }

  @Test
  void testKim2014Only() throws IOException {
    CurateDataOptions options = parse("--data-kim2014", kimPath.toString(), "--out-csv", tempDir.resolve("out.csv").toString());
    CurationResult result = CurateData.curate(options, new Parameter(null), new MhcAlleleNormalizer());

    assertEquals(3, result.recordList.size());
    assertEquals("RPPIFIRRL", result.recordList.get(2).peptide);
    assertEquals(30.0, result.recordList.get(2).measurementValue);
  }

  @Test
  void testRepeatableOptions() {
    CurateDataOptions options = parse(
        "--data-kim2014", "a,b.txt",
        "--data-kim2014", "c.txt",
        "--include-iedb-mass-spec",
        "--out-csv", "out.csv");

    assertEquals(Arrays.asList("a,b.txt", "c.txt"), options.kim2014List);
    assertTrue(options.includeIedbMassSpec);
    assertTrue(options.iedbList.isEmpty());
  }

  @Test
  void testOutCsvRequired() {
    assertThrows(ParameterException.class, () -> parse("--data-kim2014", "a.txt"));
  }

  @Test
  void testMissingInputAborts() {
    Path outPath = tempDir.resolve("out.csv");
    CurateDataOptions options = parse("--data-abelin-mass-spec", tempDir.resolve("absent.csv").toString(), "--out-csv", outPath.toString());

    assertThrows(IOException.class, () -> CurateData.curate(options, new Parameter(null), new MhcAlleleNormalizer()));
    assertFalse(Files.exists(outPath));
  }
}
