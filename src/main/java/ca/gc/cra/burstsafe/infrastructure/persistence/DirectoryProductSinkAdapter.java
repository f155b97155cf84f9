package ca.gc.cra.burstsafe.infrastructure.persistence;

import ca.gc.cra.burstsafe.application.merge.MergeResult;
import ca.gc.cra.burstsafe.application.port.ProductSinkPort;
import ca.gc.cra.burstsafe.application.render.AnnotationJsonRenderer;
import ca.gc.cra.burstsafe.application.render.ManifestJsonRenderer;
import ca.gc.cra.burstsafe.domain.product.AssembledRaster;
import ca.gc.cra.burstsafe.domain.product.ComponentRole;
import ca.gc.cra.burstsafe.domain.product.ManifestComponent;
import ca.gc.cra.burstsafe.domain.product.MergedAnnotation;
import ca.gc.cra.burstsafe.domain.raster.ComplexRaster;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes a merge result into a product directory.
 * <p><strong>Layout:</strong> {@code manifest.json}, {@code annotation/<component-id>.json} per merged document and
 * {@code measurement/<component-id>.cf32} per raster (little-endian interleaved CFloat32, no header).</p>
 * <p><strong>Thread-safety:</strong> Synchronized; one product per directory.</p>
 *
 * @since 0.1.0
 */
public final class DirectoryProductSinkAdapter implements ProductSinkPort {
  private static final Logger log = LoggerFactory.getLogger(DirectoryProductSinkAdapter.class);

  private final Path outputDirectory;
  private final AnnotationJsonRenderer annotationRenderer;
  private final ManifestJsonRenderer manifestRenderer;

  /**
   * @param outputDirectory product directory; created on first write
   * @param annotationRenderer renderer for merged documents
   * @param manifestRenderer renderer for the manifest
   */
  public DirectoryProductSinkAdapter(
      Path outputDirectory, AnnotationJsonRenderer annotationRenderer, ManifestJsonRenderer manifestRenderer) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    this.annotationRenderer = Objects.requireNonNull(annotationRenderer, "annotationRenderer");
    this.manifestRenderer = Objects.requireNonNull(manifestRenderer, "manifestRenderer");
  }

  @Override
  public synchronized void write(MergeResult result) throws Exception {
    Objects.requireNonNull(result, "result");
    Path annotationDir = Files.createDirectories(outputDirectory.resolve("annotation"));
    Path measurementDir = Files.createDirectories(outputDirectory.resolve("measurement"));
    for (MergedAnnotation annotation : result.annotations()) {
      String id = ManifestComponent.idFor(
          ComponentRole.forDocument(annotation.type()), annotation.key(), annotation.imageNumber());
      Files.write(annotationDir.resolve(id + ".json"), annotationRenderer.render(annotation));
    }
    for (AssembledRaster raster : result.rasters()) {
      int imageNumber = imageNumberOf(result, raster);
      String id = ManifestComponent.idFor(ComponentRole.MEASUREMENT, raster.key(), imageNumber);
      writeRaster(measurementDir.resolve(id + ".cf32"), raster.raster());
    }
    Files.write(outputDirectory.resolve("manifest.json"), manifestRenderer.render(result.manifest()));
    log.info("Wrote product {} to {} ({} annotations, {} rasters)",
        result.identity().uniqueId(), outputDirectory, result.annotations().size(), result.rasters().size());
  }

  private static int imageNumberOf(MergeResult result, AssembledRaster raster) {
    for (ManifestComponent component : result.manifest().components()) {
      if (component.role() == ComponentRole.MEASUREMENT && component.key().equals(raster.key())) {
        return component.imageNumber();
      }
    }
    throw new IllegalStateException("Manifest lists no measurement for " + raster.key().label());
  }

  private static void writeRaster(Path target, ComplexRaster raster) throws IOException {
    float[] line = new float[2 * raster.samples()];
    ByteBuffer bytes = ByteBuffer.allocate(Float.BYTES * line.length).order(ByteOrder.LITTLE_ENDIAN);
    try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target))) {
      for (int l = 0; l < raster.lines(); l++) {
        raster.copyLine(l, line, 0);
        bytes.clear();
        bytes.asFloatBuffer().put(line);
        out.write(bytes.array());
      }
    }
  }
}
