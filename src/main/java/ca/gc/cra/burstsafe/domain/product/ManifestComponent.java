package ca.gc.cra.burstsafe.domain.product;

import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import java.util.Locale;
import java.util.Objects;

/**
 * Manifest entry for one annotation document or measurement raster.
 *
 * @param id cross-reference id such as {@code product-iw1-vv-001}
 * @param role component role
 * @param key swath and polarization
 * @param imageNumber one-based image number
 * @param checksum MD5 hex checksum of the component content
 * @since 0.1.0
 */
public record ManifestComponent(String id, ComponentRole role, GroupKey key, int imageNumber, String checksum) {

  public ManifestComponent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(checksum, "checksum");
  }

  /**
   * Builds the cross-reference id of a component.
   *
   * @param role component role
   * @param key swath and polarization
   * @param imageNumber one-based image number
   * @return id such as {@code measurement-iw2-vh-004}
   */
  public static String idFor(ComponentRole role, GroupKey key, int imageNumber) {
    return String.format(Locale.ROOT, "%s-%s-%03d", role.idPrefix(), key.label(), imageNumber);
  }
}
