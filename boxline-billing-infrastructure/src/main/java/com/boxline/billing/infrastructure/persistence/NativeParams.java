package com.boxline.billing.infrastructure.persistence;

import jakarta.persistence.Query;

/**
 * Nullable parameters for native statements.
 *
 * PostgreSQL cannot infer the type of a bare null parameter (it arrives as bytea), so a null value
 * is written into the statement as the literal {@code NULL} and only present values are bound.
 */
public final class NativeParams {

  private NativeParams() {}

  /** {@code :name} when the value is present, {@code NULL} otherwise. */
  public static String ref(String name, Object value) {
    return value == null ? "NULL" : ":" + name;
  }

  /** Binds {@code name} only when it was referenced, see {@link #ref}. */
  public static Query bind(Query q, String name, Object value) {
    if (value != null) q.setParameter(name, value);
    return q;
  }
}
