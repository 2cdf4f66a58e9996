package com.pathhound.core.util;

import com.pathhound.core.model.ScanResponse;

/** 필터를 통과한 응답 이벤트 수신자(콘솔 리포터 등) */
@FunctionalInterface
public interface ResponseListener {
    /**
     * 워커 스레드에서 호출된다. 구현은 빠르게 반환해야 한다.
     * @param response 통과 응답(와일드카드 표시 포함 가능)
     */
    void onAccepted(ScanResponse response);

    ResponseListener NONE = r -> {};
}
