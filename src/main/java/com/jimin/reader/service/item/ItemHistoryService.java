package com.jimin.reader.service.item;

import com.jimin.reader.dto.ItemResponse;
import com.jimin.reader.dto.ItemVersionResponse;
import com.jimin.reader.exception.ItemNotFoundException;
import com.jimin.reader.repository.ItemRepository;
import com.jimin.reader.repository.ItemVersionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Item 조회 Service
 *
 * 역할: 소스별 Item 목록과 변경 이력 조회 (읽기 전용)
 * 생성/수정은 ItemReconciler 가 담당
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ItemHistoryService {

    private final ItemRepository itemRepository;
    private final ItemVersionRepository itemVersionRepository;

    /**
     * 소스의 Item 목록 (처음 관찰된 순서의 역순)
     */
    public List<ItemResponse> getItems(Long sourceId) {
        return itemRepository.findBySourceIdOrderByFirstSeenAtDesc(sourceId)
                .stream()
                .map(ItemResponse::from)
                .toList();
    }

    /**
     * 이전 버전 목록 (오래된 것부터). 현재 내용은 Item 자체에 있다
     */
    public List<ItemVersionResponse> getVersions(Long itemId) {
        if (!itemRepository.existsById(itemId)) {
            throw new ItemNotFoundException(itemId);
        }
        return itemVersionRepository.findByItemIdOrderByVersionAsc(itemId)
                .stream()
                .map(ItemVersionResponse::from)
                .toList();
    }
}
