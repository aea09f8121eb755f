package com.harness.noti.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import java.time.Instant;

/** Persisted tier of the name cache. A scope of 0 means "no guild context". */
@Entity
@Table(name = "id_cache")
@IdClass(NameCacheKey.class)
public class NameCacheEntity {

  @Id
  @Column(name = "id", nullable = false)
  private long id;

  @Id
  @Column(name = "scope_id", nullable = false)
  private long scopeId;

  @Id
  @Column(name = "obj_type", nullable = false, length = 16)
  private String objType;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "last_updated", nullable = false)
  private Instant lastUpdated;

  public NameCacheEntity() {}

  public NameCacheEntity(long id, long scopeId, String objType, String name, Instant lastUpdated) {
    this.id = id;
    this.scopeId = scopeId;
    this.objType = objType;
    this.name = name;
    this.lastUpdated = lastUpdated;
  }

  public long getId() {
    return id;
  }

  public long getScopeId() {
    return scopeId;
  }

  public String getObjType() {
    return objType;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public Instant getLastUpdated() {
    return lastUpdated;
  }

  public void setLastUpdated(Instant lastUpdated) {
    this.lastUpdated = lastUpdated;
  }
}
