package com.jimin.reader.service.fetch;

import com.jimin.reader.config.FetchProperties;
import com.jimin.reader.entity.Source;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 영구 redirect(301/308) 채택 판단
 *
 * 한 번의 301 로 바로 url 을 바꾸지 않는다. 같은 대상이 연속 N번(기본 3) 관찰되면 그때 채택.
 * Why: 잘못 설정된 서버가 잠깐 301 을 내보내도 구독 URL 이 영구히 바뀌지 않게
 *
 * Source 엔티티의 redirect_candidate_url / redirect_confirmations 만 수정한다 (저장은 호출자 트랜잭션).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedirectTracker {

    // sources.url / redirect_candidate_url 컬럼 길이
    static final int MAX_URL_LENGTH = 1000;

    private final FetchProperties properties;

    /**
     * @param permanentTarget 이번 fetch 의 영구 redirect 대상 (없으면 empty)
     * @return 채택해야 할 새 URL. 아직 확정되지 않았으면 empty
     */
    public Optional<String> observe(Source source, Optional<String> permanentTarget) {
        if (permanentTarget.isEmpty() || permanentTarget.get().equals(source.getUrl())) {
            reset(source);
            return Optional.empty();
        }

        String target = permanentTarget.get();
        if (target.length() > MAX_URL_LENGTH) {
            // 잘라낸 URL 은 다른 주소라 저장할 수 없음 → 후보로 삼지 않는다
            log.warn("redirect 대상 URL 이 너무 김, 무시: sourceId={}, length={}", source.getId(), target.length());
            reset(source);
            return Optional.empty();
        }
        if (target.equals(source.getRedirectCandidateUrl())) {
            source.setRedirectConfirmations(source.getRedirectConfirmations() + 1);
        } else {
            source.setRedirectCandidateUrl(target);
            source.setRedirectConfirmations(1);
        }

        if (source.getRedirectConfirmations() >= properties.getRedirectConfirmations()) {
            log.info("영구 redirect 확정: sourceId={}, {} → {} ({}회 연속)",
                    source.getId(), source.getUrl(), target, source.getRedirectConfirmations());
            reset(source);
            return Optional.of(target);
        }

        log.debug("영구 redirect 후보: sourceId={}, {} ({}/{})", source.getId(), target,
                source.getRedirectConfirmations(), properties.getRedirectConfirmations());
        return Optional.empty();
    }

    private void reset(Source source) {
        source.setRedirectCandidateUrl(null);
        source.setRedirectConfirmations(0);
    }
}
