package mhcdata.Allele;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MhcAlleleNormalizerTest {

  private final MhcAlleleNormalizer normalizer = new MhcAlleleNormalizer();

  @Test
  void testHuman() {
    assertEquals("HLA-A*02:01", normalizer.normalize("HLA-A*02:01"));
    assertEquals("HLA-A*02:01", normalizer.normalize("HLA-A0201"));
    assertEquals("HLA-A*02:01", normalizer.normalize("A*02:01:01"));
    assertEquals("HLA-A*02:01", normalizer.normalize("  hla-a*02:01 "));
    assertEquals("HLA-C*04:01", normalizer.normalize("HLA-Cw*0401"));
    assertEquals("HLA-B*27:05", normalizer.normalize("HLA-B*27:05N"));
    assertEquals("HLA-E*01:01", normalizer.normalize("HLA-E*01:01"));
    assertEquals("HLA-A*02", normalizer.normalize("HLA-A2"));
  }

  @Test
  void testMouse() {
    assertEquals("H-2-Kb", normalizer.normalize("H-2-Kb"));
    assertEquals("H-2-Db", normalizer.normalize("H2-Db"));
    assertEquals("H-2-Ld", normalizer.normalize("H-2Ld"));
  }

  @Test
  void testOtherSpecies() {
    assertEquals("Mamu-A*01", normalizer.normalize("Mamu-A*01"));
    assertEquals("Patr-A*01:01", normalizer.normalize("Patr-A*0101"));
    assertEquals("BoLA-HD6", normalizer.normalize("BoLA-HD6"));
    assertEquals("SLA-1*04:01", normalizer.normalize("SLA-1*04:01"));
  }

  @Test
  void testUnparseable() {
    assertEquals("UNKNOWN", normalizer.normalize("HLA class I"));
    assertEquals("UNKNOWN", normalizer.normalize("HLA-A*02:01 K66A mutant"));
    assertEquals("UNKNOWN", normalizer.normalize(""));
    assertEquals("UNKNOWN", normalizer.normalize("   "));
    assertEquals("UNKNOWN", normalizer.normalize(null));

    AlleleParse alleleParse = normalizer.parse("not an allele");
    assertFalse(alleleParse.isCanonical());
    assertEquals("not an allele", alleleParse.getRawName());
    assertThrows(IllegalStateException.class, alleleParse::getCanonicalName);
  }

  @Test
  void testParseKeepsRawName() {
    AlleleParse alleleParse = normalizer.parse("HLA-A0201");
    assertTrue(alleleParse.isCanonical());
    assertEquals("HLA-A*02:01", alleleParse.getCanonicalName());
    assertEquals("HLA-A0201", alleleParse.getRawName());
  }

  @Test
  void testFormatAlleleFields() {
    assertEquals("02", MhcAlleleNormalizer.formatAlleleFields("2"));
    assertEquals("001", MhcAlleleNormalizer.formatAlleleFields("001"));
    assertEquals("02:01", MhcAlleleNormalizer.formatAlleleFields("0201"));
    assertEquals("02:101", MhcAlleleNormalizer.formatAlleleFields("02101"));
    assertEquals("02:01", MhcAlleleNormalizer.formatAlleleFields("020101"));
    assertEquals("02:01", MhcAlleleNormalizer.formatAlleleFields("2:1:01"));
  }
}
