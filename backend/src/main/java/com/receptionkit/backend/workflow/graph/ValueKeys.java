package com.receptionkit.backend.workflow.graph;

import java.text.Normalizer;
import java.util.Collection;
import java.util.Locale;
import java.util.UUID;

/** Derives machine-friendly value keys for answer options from their labels. */
public final class ValueKeys {

  private static final int MAX_LENGTH = 64;

  private ValueKeys() {}

  public static String slugify(String label) {
    if (label == null) {
      return "";
    }
    String ascii = Normalizer.normalize(label, Normalizer.Form.NFKD).replaceAll("\\p{M}+", "");
    String slug =
        ascii.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
    return slug.length() > MAX_LENGTH ? slug.substring(0, MAX_LENGTH) : slug;
  }

  /** Slug of {@code label}, suffixed with {@code _1}, {@code _2}... until it is not in {@code taken}. */
  public static String unique(String label, Collection<String> taken) {
    String base = slugify(label);
    if (base.isEmpty()) {
      base = "path_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
    String candidate = base;
    int suffix = 1;
    while (taken.contains(candidate)) {
      candidate = base + "_" + suffix++;
    }
    return candidate;
  }
}
