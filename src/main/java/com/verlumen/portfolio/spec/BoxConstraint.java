package com.verlumen.portfolio.spec;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-asset weight bounds. A uniform box applies to every asset of the universe; an explicit map
 * only to the listed assets and takes precedence over the uniform bounds.
 */
@AutoValue
public abstract class BoxConstraint implements Constraint {
  public static BoxConstraint uniform(double min, double max) {
    return new AutoValue_BoxConstraint(Optional.of(Bounds.of(min, max)), ImmutableMap.of());
  }

  public static BoxConstraint forAssets(Map<String, Bounds> bounds) {
    return new AutoValue_BoxConstraint(Optional.empty(), ImmutableMap.copyOf(bounds));
  }

  public static BoxConstraint of(Bounds uniform, Map<String, Bounds> overrides) {
    return new AutoValue_BoxConstraint(Optional.of(uniform), ImmutableMap.copyOf(overrides));
  }

  public abstract Optional<Bounds> uniformBounds();

  public abstract ImmutableMap<String, Bounds> assetBounds();

  /** Bounds applying to {@code assetId}, if any. */
  public Optional<Bounds> boundsFor(String assetId) {
    Bounds explicit = assetBounds().get(assetId);
    return explicit != null ? Optional.of(explicit) : uniformBounds();
  }

  @Override
  public Kind kind() {
    return Kind.BOX;
  }
}
