package com.verlumen.portfolio.spec;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.verlumen.portfolio.errors.ValidationException;
import java.util.List;

/**
 * Ordered set of unique asset identifiers. The order fixes the column order of every return
 * matrix and weight vector within one run.
 */
@AutoValue
public abstract class AssetUniverse {
  public static AssetUniverse of(String... assetIds) {
    return of(ImmutableList.copyOf(assetIds));
  }

  public static AssetUniverse of(List<String> assetIds) {
    ImmutableList<String> ids = ImmutableList.copyOf(assetIds);
    if (ids.isEmpty()) {
      throw new ValidationException("Asset universe cannot be empty");
    }
    if (ImmutableSet.copyOf(ids).size() != ids.size()) {
      throw ValidationException.format("Asset ids must be unique: %s", ids);
    }
    for (String id : ids) {
      if (id.isBlank()) {
        throw new ValidationException("Asset ids cannot be blank");
      }
    }
    ImmutableMap.Builder<String, Integer> positions = ImmutableMap.builder();
    for (int i = 0; i < ids.size(); i++) {
      positions.put(ids.get(i), i);
    }
    return new AutoValue_AssetUniverse(ids, positions.buildOrThrow());
  }

  public abstract ImmutableList<String> assetIds();

  abstract ImmutableMap<String, Integer> positions();

  public int size() {
    return assetIds().size();
  }

  public boolean contains(String assetId) {
    return positions().containsKey(assetId);
  }

  /** Column index of {@code assetId}. */
  public int indexOf(String assetId) {
    Integer index = positions().get(assetId);
    if (index == null) {
      throw ValidationException.format("Unknown asset '%s'", assetId);
    }
    return index;
  }

  public String assetId(int index) {
    return assetIds().get(index);
  }
}
