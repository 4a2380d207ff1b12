package com.buhmwoo.docsearch.common.config;

import org.springframework.context.annotation.Bean; // ✅ 스프링 컨테이너에 빈을 등록하기 위해 Bean 애너테이션을 임포트합니다.
import org.springframework.context.annotation.Configuration; // ✅ 설정 클래스를 선언하기 위해 Configuration 애너테이션을 임포트합니다.
import org.springframework.http.client.reactive.ReactorClientHttpConnector; // ✅ Reactor 기반 Netty 커넥터를 사용하기 위해 임포트합니다.
import org.springframework.web.reactive.function.client.ExchangeStrategies; // ✅ 대용량 청크 목록을 받기 위해 codecs 설정을 조정합니다.
import org.springframework.web.reactive.function.client.WebClient; // ✅ RAG 백엔드와 통신할 WebClient를 생성하기 위해 임포트합니다.
import reactor.netty.http.client.HttpClient; // ✅ 타임아웃 등 네트워크 옵션을 제어하기 위해 Netty HttpClient를 임포트합니다.

import java.time.Duration;

/**
 * RAG 백엔드(청크 저장소, 문서 메타데이터, 벡터 검색, 키워드 확장) 호출에 사용할 WebClient 빈을 구성합니다.
 */
@Configuration
public class RagWebClientConfig {

    /**
     * 모든 협력 클라이언트가 공유하는 WebClient 입니다. // ✅ 호출별 타임아웃은 각 클라이언트가 block/timeout 으로 따로 겁니다.
     */
    @Bean("ragWebClient")
    public WebClient ragWebClient() {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(60)); // ✅ 사용자 전체 청크를 내려받는 경우를 고려한 상한입니다.

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codec -> codec.defaultCodecs().maxInMemorySize(64 * 1024 * 1024)) // ✅ 64MB까지 인메모리 버퍼를 확장합니다.
                        .build())
                .build();
    }
}
