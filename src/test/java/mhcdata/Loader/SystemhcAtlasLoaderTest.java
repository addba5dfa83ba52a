package mhcdata.Loader;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import mhcdata.Allele.MhcAlleleNormalizer;
import mhcdata.Types.Diagnostics;
import mhcdata.Types.MeasurementInequality;
import mhcdata.Types.MeasurementRecord;
import mhcdata.Types.MeasurementType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SystemhcAtlasLoaderTest {

  @TempDir
  Path tempDir;

  private Path path;

  @BeforeEach
  void writeFile() throws IOException {
    path = tempDir.resolve("systemhc.csv");
    Files.write(path, Arrays.asList(
        "top_allele,search_hit,prob,experiment",
        "HLA-A*02:01,GILGFVFTL,0.995,SYSMHC00001",
        "HLA-A*02:01,NLVPMVATV,0.5,SYSMHC00001",
        "HLA-A02:01,GILGFVFTL,0.999,SYSMHC00002",
        "bogus,SLYNTVATL,1.0,SYSMHC00002",
        "HLA-A*02:01,SLYNTVATL,,SYSMHC00002",
        "HLA-A*02:01,LLFGYPVYV,0.99,SYSMHC00003"), StandardCharsets.UTF_8);
  }

  @Test
  void testDefaultThreshold() throws IOException {
    SystemhcAtlasLoader loader = new SystemhcAtlasLoader(path.toString(), new MhcAlleleNormalizer(), SystemhcAtlasLoader.DEFAULT_MIN_PROBABILITY);
    List<MeasurementRecord> recordList = loader.getRecordList();

    assertEquals(2, recordList.size());

    MeasurementRecord record = recordList.get(0);
    assertEquals("HLA-A*02:01", record.allele);
    assertEquals("GILGFVFTL", record.peptide);
    assertEquals(500.0, record.measurementValue);
    assertEquals(MeasurementInequality.LESS, record.measurementInequality);
    assertEquals(MeasurementType.QUALITATIVE, record.measurementType);
    assertEquals("systemhc-atlas", record.measurementSource);
    assertEquals("HLA-A*02:01", record.originalAllele);

    assertEquals("LLFGYPVYV", recordList.get(1).peptide);

    Diagnostics diagnostics = loader.getDiagnostics();
    assertEquals(5, diagnostics.getStage("drop unparseable alleles").rowsAfter);
    assertEquals(3, diagnostics.getStage("drop probability < 0.99").rowsAfter);
    assertEquals(2, diagnostics.getStage("drop duplicate allele-peptide pairs").rowsAfter);
  }

  @Test
  void testLowerThreshold() throws IOException {
    SystemhcAtlasLoader loader = new SystemhcAtlasLoader(path.toString(), new MhcAlleleNormalizer(), 0.4);
    List<MeasurementRecord> recordList = loader.getRecordList();

    assertEquals(3, recordList.size());
    assertEquals("GILGFVFTL", recordList.get(0).peptide);
    assertEquals("NLVPMVATV", recordList.get(1).peptide);
    assertEquals("LLFGYPVYV", recordList.get(2).peptide);
  }
}
