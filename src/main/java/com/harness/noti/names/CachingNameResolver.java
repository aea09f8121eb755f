package com.harness.noti.names;

import com.harness.noti.repository.NameCacheEntity;
import com.harness.noti.repository.NameCacheKey;
import com.harness.noti.repository.NameCacheRepository;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Three tiers: process memory, the {@code id_cache} table, then the live directory. Entries
 * never expire; {@link NameRefreshJob} overwrites them periodically.
 */
@Service
public class CachingNameResolver implements NameResolver {

  private static final Logger log = LoggerFactory.getLogger(CachingNameResolver.class);
  private static final long NO_SCOPE = 0L;

  private final NameCacheRepository repository;
  private final DirectoryLookup directory;
  private final Clock clock;
  private final Map<NameCacheKey, String> memory = new ConcurrentHashMap<>();

  public CachingNameResolver(NameCacheRepository repository, DirectoryLookup directory, Clock clock) {
    this.repository = repository;
    this.directory = directory;
    this.clock = clock;
  }

  @Override
  public String resolve(NameType type, long id, Long scopeId) {
    List<NameCacheKey> keys = candidateKeys(type, id, scopeId);

    for (NameCacheKey key : keys) {
      String cached = memory.get(key);
      if (cached != null) {
        return cached;
      }
    }

    for (NameCacheKey key : keys) {
      Optional<NameCacheEntity> row = repository.findById(key);
      if (row.isPresent()) {
        memory.put(key, row.get().getName());
        return row.get().getName();
      }
    }

    return fetchLive(type, id, scopeId).orElse(type.unknown());
  }

  /**
   * Re-reads one id from the live directory, overwriting both cache tiers.
   *
   * @return true when the directory returned a name
   */
  public boolean refresh(NameType type, long id, Long scopeId) {
    return fetchLive(type, id, scopeId).isPresent();
  }

  /** Every key currently held in the persisted tier. */
  public List<NameCacheKey> persistedKeys() {
    return repository.findAll().stream()
        .map(e -> new NameCacheKey(e.getId(), e.getScopeId(), e.getObjType()))
        .toList();
  }

  private Optional<String> fetchLive(NameType type, long id, Long scopeId) {
    try {
      if (type == NameType.USER && scopeId != null && scopeId != NO_SCOPE) {
        Optional<String> nickname = directory.lookup(type, id, scopeId);
        if (nickname.isPresent()) {
          store(new NameCacheKey(id, scopeId, type.name()), nickname.get());
          return nickname;
        }
      }
      Optional<String> name = directory.lookup(type, id, null);
      name.ifPresent(n -> store(new NameCacheKey(id, NO_SCOPE, type.name()), n));
      return name;
    } catch (RuntimeException e) {
      log.warn("Live name lookup failed for {} {}: {}", type, id, e.getMessage());
      return Optional.empty();
    }
  }

  private void store(NameCacheKey key, String name) {
    memory.put(key, name);
    repository.save(new NameCacheEntity(key.getId(), key.getScopeId(), key.getObjType(), name,
        clock.instant()));
  }

  private List<NameCacheKey> candidateKeys(NameType type, long id, Long scopeId) {
    NameCacheKey global = new NameCacheKey(id, NO_SCOPE, type.name());
    if (type == NameType.USER && scopeId != null && scopeId != NO_SCOPE) {
      return List.of(new NameCacheKey(id, scopeId, type.name()), global);
    }
    return List.of(global);
  }
}
