package com.pathhound.core.crawler;

import com.pathhound.core.model.ScanResponse;

import java.net.URI;
import java.util.Set;

/** 응답 본문에서 같은 호스트의 절대 URL 을 뽑아내는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * 응답 URL 기준으로 해석한 절대 URI 집합(상위 경로 포함).
     * 파싱 실패는 빈 집합으로 처리한다.
     */
    Set<URI> extract(ScanResponse response);
}
