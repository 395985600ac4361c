package com.jimin.reader.exception;

/**
 * ItemNotFoundException - 상태를 바꾸려는 Item 이 없을 때
 *
 * 호출자 계약 위반(잘못된 itemId)이므로 병합 결과가 아니라 예외로 알린다
 */
public class ItemNotFoundException extends RuntimeException {

    private final Long itemId;

    public ItemNotFoundException(Long itemId) {
        super("Item 을 찾을 수 없습니다. ID: " + itemId);
        this.itemId = itemId;
    }

    public Long getItemId() {
        return itemId;
    }
}
