package com.harness.noti.names;

public interface NameResolver {

  /**
   * Human-readable name for a platform id. {@code scopeId} is the guild context, only
   * meaningful for users (guild nicknames); pass null otherwise.
   */
  String resolve(NameType type, long id, Long scopeId);
}
