/**
 * Field-level merge rules of the annotation documents. Each schema field maps to Include, Concatenate or Merge;
 * Merge fields resolve through a rule table and fall back to an unresolved sentinel.
 */
package ca.gc.cra.burstsafe.application.merge.strategy;
