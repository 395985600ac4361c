package com.jimin.reader.entity;

/**
 * Job 종류 (payload 형태를 구분하는 태그)
 */
public enum JobType {

    /** payload: {"sourceId": ...} */
    FETCH_SOURCE
}
