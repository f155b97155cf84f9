/**
 * Values produced by a merge run: groups and their layout, merged annotations, assembled rasters, product identity
 * and the manifest indexing them. Everything here is immutable once built.
 */
package ca.gc.cra.burstsafe.domain.product;
