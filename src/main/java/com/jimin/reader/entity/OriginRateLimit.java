package com.jimin.reader.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * OriginRateLimit Entity - origin(scheme://host:port) 별 다음 요청 가능 시각
 *
 * DB 테이블: origin_rate_limits
 * Why: 워커가 여러 프로세스로 떠도 같은 origin 에 대한 요청 간격을 공유해야 한다
 */
@Entity
@Table(name = "origin_rate_limits")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OriginRateLimit {

    @Id
    @Column(length = 300)
    private String origin;

    @Column(name = "next_slot_at", nullable = false)
    private Instant nextSlotAt;
}
