package ca.gc.cra.burstsafe.application.merge;

import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;

/**
 * Non-fatal diagnostic: a recomputed field resolved to the unresolved sentinel.
 *
 * @param documentType document kind
 * @param field field path
 * @param key group the document belongs to
 * @since 0.1.0
 */
public record UnresolvedFieldWarning(DocumentType documentType, String field, GroupKey key) {}
