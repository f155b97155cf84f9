package ca.gc.cra.burstsafe.application.merge.strategy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class AnnotationSchemasTest {

  @Test
  void productListsUseTheirScopes() {
    Map<String, FieldRule> rules = AnnotationSchemas.forType(DocumentType.PRODUCT).stream()
        .collect(Collectors.toMap(FieldRule::path, rule -> rule));

    assertEquals(FieldRule.ListScope.ALL, rules.get(AnnotationSchemas.QUALITY_DATA_LIST).scope());
    assertEquals(FieldRule.ListScope.UNIQUE, rules.get(AnnotationSchemas.REPLICA_INFORMATION_LIST).scope());
    assertEquals(FieldRule.ListScope.WINDOWED, rules.get("generalAnnotation/rawDataAnalysisList").scope());
    assertEquals(FieldRule.ListScope.WINDOWED, rules.get("generalAnnotation/noiseList").scope());
    assertEquals(FieldRule.ListScope.WINDOWED, rules.get(AnnotationSchemas.INPUT_DIMENSIONS_LIST).scope());
    assertEquals(FieldRule.ListScope.EMPTIED, rules.get(AnnotationSchemas.SLICE_LIST).scope());
    assertEquals(FieldRule.ListScope.EMPTIED, rules.get(AnnotationSchemas.COORDINATE_CONVERSION_LIST).scope());
    assertEquals(FieldRule.ListScope.EMPTIED, rules.get(AnnotationSchemas.SWATH_MERGE_LIST).scope());
    assertEquals(MergeStrategy.CONCATENATE, rules.get(AnnotationSchemas.SLICE_LIST).strategy());
  }

  @Test
  void listScopeRequiresConcatenation() {
    assertThrows(IllegalArgumentException.class, () -> new FieldRule(
        "x", MergeStrategy.INCLUDE, false, null, false, false, FieldRule.ListScope.EMPTIED));
  }
}
