package com.pathhound.core.filter;

import com.pathhound.core.model.ScanResponse;

/**
 * 분류 결과.
 * @param accepted  통과 여부
 * @param droppedBy 떨어뜨린 단계(통과면 null)
 * @param response  최종 응답(와일드카드 표시가 붙었을 수 있음)
 * @param recurse   통과 + 디렉터리로 보이는 응답이면 true
 */
public record FilterDecision(boolean accepted, FilterRule.Kind droppedBy, ScanResponse response, boolean recurse) {

    static FilterDecision accept(ScanResponse r, boolean recurse) {
        return new FilterDecision(true, null, r, recurse);
    }

    static FilterDecision drop(FilterRule.Kind kind, ScanResponse r) {
        return new FilterDecision(false, kind, r, false);
    }
}
