package com.jimin.reader.service.job;

/**
 * FETCH_SOURCE Job payload ({"sourceId": 42})
 */
public record FetchSourcePayload(Long sourceId) {
}
