package com.jimin.reader.service.job;

import com.jimin.reader.entity.Job;
import com.jimin.reader.entity.JobType;

/**
 * JobType 별 실행기
 *
 * handle() 안에서 예상 가능한 실패(네트워크, HTTP 오류)는 실패 JobOutcome 으로 돌려준다.
 * 던져진 예외는 JobRunner 가 잡아서 실패로 기록한다.
 */
public interface JobHandler {

    JobType type();

    JobOutcome handle(Job job);
}
