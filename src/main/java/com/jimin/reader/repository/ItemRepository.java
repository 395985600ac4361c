package com.jimin.reader.repository;

import com.jimin.reader.entity.Item;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ItemRepository extends JpaRepository<Item, Long> {

    Optional<Item> findBySourceIdAndDedupeKey(Long sourceId, String dedupeKey);

    List<Item> findBySourceIdOrderByFirstSeenAtDesc(Long sourceId);

    long countBySourceId(Long sourceId);
}
