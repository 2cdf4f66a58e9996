package com.pathhound.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 하나의 베이스 URL에 대한 워드리스트 스캔 단위.
 *
 * <p>id/baseUrl/type/parent/depth/order 는 불변. status/threadCount/rateLimit/cancelReason 은
 * ScanRegistry(상태)와 AutoTuner(스레드/레이트)만 갱신한다. 외부 공개용으로는 {@link #copy()}
 * 스냅샷을 넘긴다.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Scan {
    private final String id;
    private final String baseUrl;
    private final ScanType scanType;
    private final String parentId;     // 약한 역참조(id만 보관)
    private final int depth;
    private final long order;          // 등록 순번(FIFO 승인 기준)

    private volatile ScanStatus status;
    private volatile int threadCount;
    private volatile int rateLimit;    // 0 = 무제한
    private volatile String cancelReason;

    @JsonCreator
    public Scan(@JsonProperty("id") String id,
                @JsonProperty("baseUrl") String baseUrl,
                @JsonProperty("scanType") ScanType scanType,
                @JsonProperty("parentId") String parentId,
                @JsonProperty("depth") int depth,
                @JsonProperty("order") long order,
                @JsonProperty("status") ScanStatus status,
                @JsonProperty("threadCount") int threadCount,
                @JsonProperty("rateLimit") int rateLimit,
                @JsonProperty("cancelReason") String cancelReason) {
        this.id = Objects.requireNonNull(id, "id");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.scanType = (scanType == null ? ScanType.DIRECTORY : scanType);
        this.parentId = parentId;
        this.depth = Math.max(0, depth);
        this.order = order;
        this.status = (status == null ? ScanStatus.QUEUED : status);
        this.threadCount = Math.max(1, threadCount);
        this.rateLimit = Math.max(0, rateLimit);
        this.cancelReason = cancelReason;
    }

    public String getId() { return id; }
    public String getBaseUrl() { return baseUrl; }
    public ScanType getScanType() { return scanType; }
    public String getParentId() { return parentId; }
    public int getDepth() { return depth; }
    public long getOrder() { return order; }
    public ScanStatus getStatus() { return status; }
    public int getThreadCount() { return threadCount; }
    public int getRateLimit() { return rateLimit; }
    public String getCancelReason() { return cancelReason; }

    /** 메뉴/로그용 짧은 id (앞 8자) */
    public String shortId() {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }

    /** ScanRegistry 잠금 하에서만 호출 */
    public void setStatus(ScanStatus status) { this.status = Objects.requireNonNull(status, "status"); }
    public void setCancelReason(String cancelReason) { this.cancelReason = cancelReason; }

    /** AutoTuner 전용: 단조 감소 규칙은 호출자가 보장 */
    public void setThreadCount(int threadCount) { this.threadCount = Math.max(1, threadCount); }
    public void setRateLimit(int rateLimit) { this.rateLimit = Math.max(0, rateLimit); }

    public Scan copy() {
        return new Scan(id, baseUrl, scanType, parentId, depth, order, status, threadCount, rateLimit, cancelReason);
    }

    @Override
    public String toString() {
        return "Scan{" + shortId() + " " + scanType + " " + baseUrl + " depth=" + depth + " " + status + "}";
    }
}
