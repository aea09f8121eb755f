package com.harness.noti.names;

import java.util.Optional;

/** Live lookup against the chat platform; slow and rate limited, hence the caches in front. */
public interface DirectoryLookup {

  /**
   * @param scopeId guild for a nickname lookup, or null for the global name
   * @return the name, or empty when the platform does not know the id
   */
  Optional<String> lookup(NameType type, long id, Long scopeId);
}
