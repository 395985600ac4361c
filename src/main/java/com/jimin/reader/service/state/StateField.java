package com.jimin.reader.service.state;

/**
 * 사용자가 바꿀 수 있는 Item 상태. 필드마다 변경 시각이 따로 있다
 */
public enum StateField {
    READ,
    STARRED
}
