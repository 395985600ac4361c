package com.jimin.reader.repository;

import com.jimin.reader.entity.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    Optional<Subscription> findByUserIdAndSourceId(Long userId, Long sourceId);

    // 새 Item 이 생겼을 때 상태 row 를 만들어 줄 대상
    List<Subscription> findBySourceIdAndActiveTrue(Long sourceId);

    boolean existsBySourceIdAndActiveTrue(Long sourceId);
}
