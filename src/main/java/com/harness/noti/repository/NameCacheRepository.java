package com.harness.noti.repository;

import org.springframework.data.jpa.repository.JpaRepository;

public interface NameCacheRepository extends JpaRepository<NameCacheEntity, NameCacheKey> {}
