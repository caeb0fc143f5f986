package com.yerin.pipeline.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 콜백 전송용 RestTemplate. 시도마다 연결/읽기 타임아웃이 적용된다.
     */
    @Bean
    @Qualifier("callbackRestTemplate")
    public RestTemplate callbackRestTemplate(RestTemplateBuilder builder,
                                             @Value("${pipeline.callback.timeout:10s}") Duration timeout) {
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    /**
     * 외부 처리기(http processor) 호출용 RestTemplate.
     */
    @Bean
    @Qualifier("processorRestTemplate")
    public RestTemplate processorRestTemplate(RestTemplateBuilder builder,
                                              @Value("${pipeline.processor.http.timeout:60s}") Duration timeout) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(timeout)
                .build();
    }
}
