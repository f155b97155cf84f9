/**
 * <strong>Purpose:</strong> Merge engine services: eligibility, grouping, raster stitching, annotation assembly,
 * product identity and manifest building.
 * <p><strong>Pipeline role:</strong> Called by {@link ca.gc.cra.burstsafe.application.pipeline.BurstMergeUseCase}
 * once per run (validation, grouping, identity, manifest) or once per group (stitching, assembly).</p>
 * <p><strong>Errors:</strong> Input-caused failures are checked {@link
 * ca.gc.cra.burstsafe.application.merge.MergeException} subtypes; disagreement between independently computed
 * results raises {@link ca.gc.cra.burstsafe.application.merge.InternalConsistencyException}.</p>
 * <p><strong>Concurrency:</strong> Services are stateless; one instance may serve several groups concurrently.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burstsafe.application.merge;
