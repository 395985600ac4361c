package com.jimin.reader.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.lang.NonNull;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;

/**
 * 피드 fetch 용 RestTemplate
 *
 * - redirect 자동 추적 OFF: 301(영구) / 302,307(임시)를 구분해서 직접 따라가야 함
 * - 4xx/5xx 에서 예외를 던지지 않음: 상태 코드 자체가 fetch 결과로 분류된다
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate feedRestTemplate(FetchProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(properties.getTimeout())
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getTimeout());

        RestTemplate restTemplate = new RestTemplate(requestFactory);
        restTemplate.setErrorHandler(new PassThroughErrorHandler());
        return restTemplate;
    }

    static class PassThroughErrorHandler implements ResponseErrorHandler {

        @Override
        public boolean hasError(@NonNull ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(@NonNull ClientHttpResponse response) {
            // hasError() 가 항상 false 라 호출되지 않음
        }
    }
}
