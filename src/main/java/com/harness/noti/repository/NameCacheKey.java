package com.harness.noti.repository;

import java.io.Serializable;
import java.util.Objects;

public class NameCacheKey implements Serializable {

  private long id;
  private long scopeId;
  private String objType;

  public NameCacheKey() {}

  public NameCacheKey(long id, long scopeId, String objType) {
    this.id = id;
    this.scopeId = scopeId;
    this.objType = objType;
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

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NameCacheKey other)) {
      return false;
    }
    return id == other.id && scopeId == other.scopeId && Objects.equals(objType, other.objType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, scopeId, objType);
  }
}
