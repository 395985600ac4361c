package com.jimin.reader.repository;

import com.jimin.reader.entity.Source;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface SourceRepository extends JpaRepository<Source, Long> {

    Optional<Source> findByUrl(String url);

    boolean existsByUrl(String url);

    // Why: 같은 소스에 대한 구독/해지를 직렬화하기 위한 row lock
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Source s WHERE s.id = :id")
    Optional<Source> findByIdForUpdate(@Param("id") Long id);

    // 실패 중인 소스 (최근 fetch 순)
    List<Source> findByConsecutiveFailuresGreaterThanEqualOrderByLastFetchedAtDesc(int minFailures);
}
