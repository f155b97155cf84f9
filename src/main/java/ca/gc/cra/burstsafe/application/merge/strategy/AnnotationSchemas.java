package ca.gc.cra.burstsafe.application.merge.strategy;

import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Static field tables mapping every merged annotation field to its strategy, per document type.
 * <p><strong>Why:</strong> Strategy selection is data, not runtime type inspection: the assembler walks these tables
 * in order, and the order of a table is the field order of the merged document.</p>
 * <p><strong>Thread-safety:</strong> Immutable after class initialization.</p>
 *
 * @implNote Orbit and attitude style lists keep a 500 s margin around the group window so that interpolators have
 * support beyond the first and last line; the burst list keeps 0.1 s so neighbouring bursts are not picked up.
 * @since 0.1.0
 */
public final class AnnotationSchemas {
  public static final String START_TIME = "adsHeader/startTime";
  public static final String STOP_TIME = "adsHeader/stopTime";
  public static final String IMAGE_NUMBER = "adsHeader/imageNumber";

  static final String PRODUCT_INFORMATION = "generalAnnotation/productInformation/";
  static final String IMAGE_INFORMATION = "imageAnnotation/imageInformation/";

  public static final String PLATFORM_HEADING = PRODUCT_INFORMATION + "platformHeading";
  public static final String FIRST_LINE_TIME = IMAGE_INFORMATION + "productFirstLineUtcTime";
  public static final String LAST_LINE_TIME = IMAGE_INFORMATION + "productLastLineUtcTime";
  public static final String PRODUCT_COMPOSITION = IMAGE_INFORMATION + "productComposition";
  public static final String SLICE_NUMBER = IMAGE_INFORMATION + "sliceNumber";
  public static final String AZIMUTH_PIXEL_SPACING = IMAGE_INFORMATION + "azimuthPixelSpacing";
  public static final String AZIMUTH_TIME_INTERVAL = IMAGE_INFORMATION + "azimuthTimeInterval";
  public static final String NUMBER_OF_SAMPLES = IMAGE_INFORMATION + "numberOfSamples";
  public static final String NUMBER_OF_LINES = IMAGE_INFORMATION + "numberOfLines";
  public static final String INCIDENCE_ANGLE_MID_SWATH = IMAGE_INFORMATION + "incidenceAngleMidSwath";
  public static final String MEAN_RE = IMAGE_INFORMATION + "imageStatistics/outputDataMean/re";
  public static final String MEAN_IM = IMAGE_INFORMATION + "imageStatistics/outputDataMean/im";
  public static final String STD_DEV_RE = IMAGE_INFORMATION + "imageStatistics/outputDataStdDev/re";
  public static final String STD_DEV_IM = IMAGE_INFORMATION + "imageStatistics/outputDataStdDev/im";
  public static final String QUALITY_INDEX = "qualityInformation/productQualityIndex";
  public static final String LINES_PER_BURST = "swathTiming/linesPerBurst";
  public static final String SAMPLES_PER_BURST = "swathTiming/samplesPerBurst";
  public static final String BURST_LIST = "swathTiming/burstList";
  public static final String GEOLOCATION_GRID = "geolocationGrid/geolocationGridPointList";
  public static final String ORBIT_LIST = "generalAnnotation/orbitList";
  public static final String REPLICA_INFORMATION_LIST = "generalAnnotation/replicaInformationList";
  public static final String QUALITY_DATA_LIST = "qualityInformation/qualityDataList";
  public static final String INPUT_DIMENSIONS_LIST = "imageAnnotation/processingInformation/inputDimensionsList";
  public static final String SLICE_LIST = IMAGE_INFORMATION + "sliceList";
  public static final String COORDINATE_CONVERSION_LIST = "coordinateConversion/coordinateConversionList";
  public static final String SWATH_MERGE_LIST = "swathMerging/swathMergeList";
  public static final String CALIBRATION_VECTORS = "calibrationVectorList";
  public static final String NOISE_RANGE_VECTORS = "noiseRangeVectorList";
  public static final String NOISE_AZIMUTH_VECTORS = "noiseAzimuthVectorList";
  public static final String RFI_MITIGATION_APPLIED = "rfiMitigationApplied";

  private static final Duration ORBIT_BUFFER = Duration.ofSeconds(500);
  private static final Duration BURST_LIST_BUFFER = Duration.ofMillis(100);

  private static final Map<DocumentType, List<FieldRule>> SCHEMAS = buildSchemas();

  private AnnotationSchemas() {}

  /**
   * Returns the field table of a document type.
   *
   * @param type document kind
   * @return ordered immutable field rules
   */
  public static List<FieldRule> forType(DocumentType type) {
    return SCHEMAS.get(Objects.requireNonNull(type, "type"));
  }

  private static Map<DocumentType, List<FieldRule>> buildSchemas() {
    Map<DocumentType, List<FieldRule>> schemas = new EnumMap<>(DocumentType.class);
    schemas.put(DocumentType.PRODUCT, product());
    schemas.put(DocumentType.CALIBRATION, calibration());
    schemas.put(DocumentType.NOISE, noise());
    schemas.put(DocumentType.RFI, rfi());
    return schemas;
  }

  private static List<FieldRule> header() {
    List<FieldRule> rules = new ArrayList<>();
    rules.add(FieldRule.include("adsHeader/missionId").asRequired());
    rules.add(FieldRule.include("adsHeader/productType"));
    rules.add(FieldRule.include("adsHeader/polarisation").asRequired());
    rules.add(FieldRule.include("adsHeader/mode").asRequired());
    rules.add(FieldRule.include("adsHeader/swath").asRequired());
    rules.add(FieldRule.merge(START_TIME).asRequired());
    rules.add(FieldRule.merge(STOP_TIME).asRequired());
    rules.add(FieldRule.include("adsHeader/absoluteOrbitNumber").asRequired());
    rules.add(FieldRule.include("adsHeader/missionDataTakeId"));
    rules.add(FieldRule.merge(IMAGE_NUMBER).asRequired());
    return rules;
  }

  private static List<FieldRule> product() {
    List<FieldRule> rules = header();
    rules.add(FieldRule.merge(QUALITY_INDEX));
    rules.add(FieldRule.concatenateAll(QUALITY_DATA_LIST));
    rules.add(FieldRule.include(PRODUCT_INFORMATION + "pass"));
    rules.add(FieldRule.include(PRODUCT_INFORMATION + "timelinessCategory"));
    rules.add(FieldRule.merge(PLATFORM_HEADING));
    rules.add(FieldRule.include(PRODUCT_INFORMATION + "projection"));
    rules.add(FieldRule.include(PRODUCT_INFORMATION + "rangeSamplingRate").asRequired());
    rules.add(FieldRule.include(PRODUCT_INFORMATION + "radarFrequency").asRequired());
    rules.add(FieldRule.include(PRODUCT_INFORMATION + "azimuthSteeringRate"));
    rules.add(FieldRule.concatenate("generalAnnotation/downlinkInformationList", ORBIT_BUFFER));
    rules.add(FieldRule.concatenate(ORBIT_LIST, ORBIT_BUFFER).asRequired());
    rules.add(FieldRule.concatenate("generalAnnotation/attitudeList", ORBIT_BUFFER));
    rules.add(FieldRule.concatenate("generalAnnotation/rawDataAnalysisList", ORBIT_BUFFER));
    rules.add(FieldRule.concatenateUnique(REPLICA_INFORMATION_LIST));
    rules.add(FieldRule.concatenate("generalAnnotation/noiseList", ORBIT_BUFFER));
    rules.add(FieldRule.concatenate("generalAnnotation/terrainHeightList", ORBIT_BUFFER));
    rules.add(FieldRule.concatenate("generalAnnotation/azimuthFmRateList", ORBIT_BUFFER));
    rules.add(FieldRule.merge(FIRST_LINE_TIME));
    rules.add(FieldRule.merge(LAST_LINE_TIME));
    rules.add(FieldRule.include(IMAGE_INFORMATION + "ascendingNodeTime").asRequired());
    rules.add(FieldRule.merge(PRODUCT_COMPOSITION));
    rules.add(FieldRule.merge(SLICE_NUMBER));
    rules.add(FieldRule.emptied(SLICE_LIST));
    rules.add(FieldRule.include(IMAGE_INFORMATION + "slantRangeTime"));
    rules.add(FieldRule.include(IMAGE_INFORMATION + "pixelValue"));
    rules.add(FieldRule.include(IMAGE_INFORMATION + "outputPixels"));
    rules.add(FieldRule.include(IMAGE_INFORMATION + "rangePixelSpacing"));
    rules.add(FieldRule.merge(AZIMUTH_PIXEL_SPACING));
    rules.add(FieldRule.include(AZIMUTH_TIME_INTERVAL).asRequired());
    rules.add(FieldRule.include(IMAGE_INFORMATION + "azimuthFrequency"));
    rules.add(FieldRule.merge(NUMBER_OF_SAMPLES));
    rules.add(FieldRule.merge(NUMBER_OF_LINES).asRequired().asBurstAligned());
    rules.add(FieldRule.merge(INCIDENCE_ANGLE_MID_SWATH));
    rules.add(FieldRule.merge(MEAN_RE).asBurstAligned());
    rules.add(FieldRule.merge(MEAN_IM).asBurstAligned());
    rules.add(FieldRule.merge(STD_DEV_RE).asBurstAligned());
    rules.add(FieldRule.merge(STD_DEV_IM).asBurstAligned());
    rules.add(FieldRule.concatenate(INPUT_DIMENSIONS_LIST));
    rules.add(FieldRule.concatenate("dopplerCentroid/dcEstimateList"));
    rules.add(FieldRule.concatenate("antennaPattern/antennaPatternList"));
    rules.add(FieldRule.merge(LINES_PER_BURST).asRequired());
    rules.add(FieldRule.merge(SAMPLES_PER_BURST).asRequired());
    rules.add(FieldRule.concatenate(BURST_LIST, BURST_LIST_BUFFER).asRequired().asBurstAligned());
    rules.add(FieldRule.concatenate(GEOLOCATION_GRID).asRequired().withLineBounds().asBurstAligned());
    rules.add(FieldRule.emptied(COORDINATE_CONVERSION_LIST));
    rules.add(FieldRule.emptied(SWATH_MERGE_LIST));
    return List.copyOf(rules);
  }

  private static List<FieldRule> calibration() {
    List<FieldRule> rules = header();
    rules.add(FieldRule.include("calibrationInformation/absoluteCalibrationConstant").asRequired());
    rules.add(FieldRule.concatenate(CALIBRATION_VECTORS).asRequired().asBurstAligned());
    return List.copyOf(rules);
  }

  private static List<FieldRule> noise() {
    List<FieldRule> rules = header();
    rules.add(FieldRule.concatenate(NOISE_RANGE_VECTORS).asRequired().asBurstAligned());
    rules.add(FieldRule.concatenate(NOISE_AZIMUTH_VECTORS).withLineBounds().asBurstAligned());
    return List.copyOf(rules);
  }

  private static List<FieldRule> rfi() {
    List<FieldRule> rules = header();
    rules.add(FieldRule.include(RFI_MITIGATION_APPLIED).asRequired());
    rules.add(FieldRule.concatenate("rfiDetectionFromNoiseReportList"));
    rules.add(FieldRule.concatenate("rfiBurstReportList"));
    return List.copyOf(rules);
  }
}
