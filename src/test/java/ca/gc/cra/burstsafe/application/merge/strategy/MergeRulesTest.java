package ca.gc.cra.burstsafe.application.merge.strategy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.burst.Polarization;
import ca.gc.cra.burstsafe.domain.burst.Swath;
import ca.gc.cra.burstsafe.domain.product.BurstGroup;
import ca.gc.cra.burstsafe.domain.product.GroupLayout;
import ca.gc.cra.burstsafe.domain.product.MergedValue;
import ca.gc.cra.burstsafe.domain.raster.RasterStatistics;
import ca.gc.cra.burstsafe.testutil.BurstFixtures;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MergeRulesTest {
  private static final GroupKey KEY = new GroupKey(Swath.IW1, Polarization.VV);

  private GroupLayout layout;

  @BeforeEach
  void setUp() {
    layout = GroupLayout.of(new BurstGroup(KEY, BurstFixtures.twoBurstGroup(Polarization.VV)));
  }

  @Test
  void timesFollowGroupExtent() {
    assertEquals("2024-03-01T10:00:00.000000", apply(AnnotationSchemas.START_TIME, List.of()));
    assertEquals("2024-03-01T10:00:01.600000", apply(AnnotationSchemas.STOP_TIME, List.of()));
    assertEquals("2024-03-01T10:00:00.000000", apply(AnnotationSchemas.FIRST_LINE_TIME, List.of()));
    assertEquals("2024-03-01T10:00:01.600000", apply(AnnotationSchemas.LAST_LINE_TIME, List.of()));
  }

  @Test
  void structuralFieldsAreRecomputed() {
    assertEquals("17", apply(AnnotationSchemas.NUMBER_OF_LINES, List.of("10", "10")));
    assertEquals("007", rule(AnnotationSchemas.IMAGE_NUMBER)
        .apply(new MergeContext(KEY, DocumentType.PRODUCT, 7, layout, Optional.empty(), false), List.of())
        .text().orElseThrow());
    assertEquals("Assembled", apply(AnnotationSchemas.PRODUCT_COMPOSITION, List.of("Individual")));
    assertEquals("0", apply(AnnotationSchemas.SLICE_NUMBER, List.of("3")));
  }

  @Test
  void meansAndMaximaAggregateMemberValues() {
    assertEquals("-1.10000000000000e+01", apply(AnnotationSchemas.PLATFORM_HEADING, List.of("-10.0", "-12.0")));
    assertEquals("1.400000e+01", apply(AnnotationSchemas.AZIMUTH_PIXEL_SPACING, List.of("14.0", "14.0")));
    assertEquals("6", apply(AnnotationSchemas.NUMBER_OF_SAMPLES, List.of("4", "6")));
    assertEquals("10", apply(AnnotationSchemas.LINES_PER_BURST, List.of("10", "9")));
  }

  @Test
  void malformedValuesAreUnresolved() {
    assertFalse(raw(AnnotationSchemas.NUMBER_OF_SAMPLES, List.of("4", "wide")).isResolved());
    assertFalse(raw(AnnotationSchemas.PLATFORM_HEADING, List.of("NaN")).isResolved());
    assertFalse(raw(AnnotationSchemas.PLATFORM_HEADING, List.of()).isResolved());
  }

  @Test
  void statisticsComeFromStitchedRaster() {
    MergeContext withStatistics = new MergeContext(KEY, DocumentType.PRODUCT, 1, layout,
        Optional.of(new RasterStatistics(1.5, -0.25, 2.0, 0.5, 10)), false);

    assertEquals("1.500000e+00", rule(AnnotationSchemas.MEAN_RE).apply(withStatistics, List.of()).text().orElseThrow());
    assertEquals("-2.500000e-01", rule(AnnotationSchemas.MEAN_IM).apply(withStatistics, List.of()).text().orElseThrow());
    assertEquals("2.000000e+00", rule(AnnotationSchemas.STD_DEV_RE).apply(withStatistics, List.of()).text().orElseThrow());
    assertFalse(raw(AnnotationSchemas.MEAN_RE, List.of("0.0")).isResolved());
  }

  @Test
  void fieldsWithoutRuleHaveNoEntry() {
    assertTrue(MergeRules.forField(AnnotationSchemas.QUALITY_INDEX).isEmpty());
    assertTrue(MergeRules.forField(AnnotationSchemas.INCIDENCE_ANGLE_MID_SWATH).isEmpty());
  }

  private String apply(String path, List<String> values) {
    return raw(path, values).text().orElseThrow();
  }

  private MergedValue raw(String path, List<String> values) {
    return rule(path).apply(new MergeContext(KEY, DocumentType.PRODUCT, 1, layout, Optional.empty(), false), values);
  }

  private static MergeRule rule(String path) {
    return MergeRules.forField(path).orElseThrow();
  }
}
