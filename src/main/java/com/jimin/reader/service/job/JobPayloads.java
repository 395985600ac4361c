package com.jimin.reader.service.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jimin.reader.entity.Job;
import com.jimin.reader.exception.JobPayloadException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Job.payload(JSON) ↔ payload record 변환
 */
@Component
@RequiredArgsConstructor
public class JobPayloads {

    private final ObjectMapper objectMapper;

    public String write(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload 직렬화 실패: " + payload, e);
        }
    }

    /**
     * @throws JobPayloadException JSON 이 깨졌거나 sourceId 가 없을 때
     */
    public FetchSourcePayload readFetchSource(Job job) {
        FetchSourcePayload payload;
        try {
            payload = objectMapper.readValue(job.getPayload(), FetchSourcePayload.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new JobPayloadException(job.getId(), "JSON 파싱 실패: " + job.getPayload(), e);
        }
        if (payload == null || payload.sourceId() == null) {
            throw new JobPayloadException(job.getId(), "sourceId 누락: " + job.getPayload());
        }
        return payload;
    }
}
