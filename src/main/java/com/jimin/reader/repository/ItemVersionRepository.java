package com.jimin.reader.repository;

import com.jimin.reader.entity.ItemVersion;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ItemVersionRepository extends JpaRepository<ItemVersion, Long> {

    // 변경 이력 (오래된 버전부터)
    List<ItemVersion> findByItemIdOrderByVersionAsc(Long itemId);

    long countByItemId(Long itemId);
}
