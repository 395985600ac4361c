package com.jimin.reader.repository;

import com.jimin.reader.entity.OriginRateLimit;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface OriginRateLimitRepository extends JpaRepository<OriginRateLimit, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM OriginRateLimit o WHERE o.origin = :origin")
    Optional<OriginRateLimit> findByOriginForUpdate(@Param("origin") String origin);
}
