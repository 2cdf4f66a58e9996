package com.pathhound.core.scan;

import com.pathhound.core.error.DepthExceededException;
import com.pathhound.core.model.Scan;
import com.pathhound.core.model.ScanStatus;
import com.pathhound.core.model.ScanType;
import com.pathhound.core.util.StructuredLog;
import com.pathhound.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * 모든 Scan 의 단일 소유자. 모든 변경은 하나의 락으로 선형화되고,
 * 변경이 있을 때마다 {@link #awaitChange} 대기자를 깨운다.
 *
 * <p>외부에는 {@link Scan#copy()} 스냅샷만 내보낸다.
 * 단, {@link #isCancelled(String)} 처럼 volatile 필드 하나를 읽는 조회는 락 없이 수행한다.</p>
 */
public final class ScanRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ScanRegistry.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanRegistry.class);

    private static final Comparator<Scan> FIFO =
            Comparator.comparingLong(Scan::getOrder).thenComparing(Scan::getId);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final LinkedHashMap<String, Scan> scans = new LinkedHashMap<>();
    private final Map<String, String> idByUrl = new HashMap<>();
    private final ConcurrentHashMap<String, Scan> index = new ConcurrentHashMap<>(); // 락 없는 조회용
    private final int maxDepth;
    private final int defaultThreads;
    private final int defaultRate;
    private long seq = 0;

    /**
     * @param maxDepth       0 = 무제한
     * @param defaultThreads 새 스캔의 워커 수
     * @param defaultRate    새 스캔의 초당 요청 상한(0 = 무제한)
     */
    public ScanRegistry(int maxDepth, int defaultThreads, int defaultRate) {
        this.maxDepth = Math.max(0, maxDepth);
        this.defaultThreads = Math.max(1, defaultThreads);
        this.defaultRate = Math.max(0, defaultRate);
    }

    /* =========================
       등록
       ========================= */

    /**
     * 새 스캔을 QUEUED 로 등록하고 id 를 돌려준다.
     * @throws DepthExceededException depth 가 maxDepth 초과(maxDepth > 0)
     * @throws IllegalArgumentException 알 수 없는 parentId
     */
    public String register(String baseUrl, ScanType type, String parentId, int depth) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(type, "type");
        lock.lock();
        try {
            checkRegistrable(parentId, depth);
            return insert(baseUrl, type, parentId, depth, ScanStatus.QUEUED);
        } finally {
            lock.unlock();
        }
    }

    /** 같은 URL 의 스캔이 이미 있으면 empty (재귀 경쟁 중복 제거) */
    public Optional<String> registerIfAbsent(String baseUrl, ScanType type, String parentId, int depth) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        lock.lock();
        try {
            if (idByUrl.containsKey(keyOf(baseUrl))) return Optional.empty();
            checkRegistrable(parentId, depth);
            return Optional.of(insert(baseUrl, type, parentId, depth, ScanStatus.QUEUED));
        } finally {
            lock.unlock();
        }
    }

    /** 목록 페이지로 확인된 디렉터리: 워드리스트를 돌리지 않으므로 바로 COMPLETE */
    public Optional<String> registerListing(String baseUrl, String parentId, int depth) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        lock.lock();
        try {
            if (idByUrl.containsKey(keyOf(baseUrl))) return Optional.empty();
            checkRegistrable(parentId, depth);
            return Optional.of(insert(baseUrl, ScanType.DIRECTORY, parentId, depth, ScanStatus.COMPLETE));
        } finally {
            lock.unlock();
        }
    }

    /** 링크 추출로 찾은 단일 파일: 실행하지 않으므로 바로 COMPLETE 로 기록 */
    public Optional<String> registerFile(String url, String parentId, int depth) {
        lock.lock();
        try {
            if (idByUrl.containsKey(keyOf(url))) return Optional.empty();
            checkRegistrable(parentId, depth);
            return Optional.of(insert(url, ScanType.FILE, parentId, depth, ScanStatus.COMPLETE));
        } finally {
            lock.unlock();
        }
    }

    private void checkRegistrable(String parentId, int depth) {
        if (maxDepth > 0 && depth > maxDepth) throw new DepthExceededException(depth, maxDepth);
        if (parentId != null && !scans.containsKey(parentId)) {
            throw new IllegalArgumentException("unknown parent scan: " + parentId);
        }
    }

    private String insert(String baseUrl, ScanType type, String parentId, int depth, ScanStatus status) {
        String id = UUID.randomUUID().toString().replace("-", "");
        Scan s = new Scan(id, baseUrl, type, parentId, depth, seq++, status, defaultThreads, defaultRate, null);
        scans.put(id, s);
        index.put(id, s);
        idByUrl.put(keyOf(baseUrl), id);
        changed.signalAll();
        LOG.debug("Registered {}", s);
        SLOG.debug("scan-registered", "scan", id, "url", baseUrl, "type", type.name(), "depth", depth,
                "parent", parentId);
        return id;
    }

    private static String keyOf(String url) {
        try {
            return UrlUtils.directoryBase(url);
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    /* =========================
       상태 전이
       ========================= */

    /** 허용되지 않은 전이는 false + 경고(예외 없음) */
    public boolean transition(String id, ScanStatus next) {
        lock.lock();
        try {
            return transitionLocked(id, next, null);
        } finally {
            lock.unlock();
        }
    }

    private boolean transitionLocked(String id, ScanStatus next, String reason) {
        Scan s = scans.get(id);
        if (s == null) {
            LOG.warn("Transition to {} for unknown scan {}", next, id);
            return false;
        }
        ScanStatus cur = s.getStatus();
        if (!cur.canTransitionTo(next)) {
            LOG.warn("Illegal transition {} -> {} for {}", cur, next, s);
            return false;
        }
        s.setStatus(next);
        if (next == ScanStatus.CANCELLED) s.setCancelReason(reason);
        changed.signalAll();
        SLOG.debug("scan-transition", "scan", id, "from", cur.name(), "to", next.name(), "reason", reason);
        return true;
    }

    public boolean cancel(String id, String reason) {
        lock.lock();
        try {
            return transitionLocked(id, ScanStatus.CANCELLED, reason);
        } finally {
            lock.unlock();
        }
    }

    /** 스캔과 종단이 아닌 모든 후손을 취소. 실제로 취소된 id 목록 반환 */
    public List<String> cancelTree(String id, String reason) {
        lock.lock();
        try {
            List<String> out = new ArrayList<>();
            Deque<String> todo = new ArrayDeque<>();
            todo.add(id);
            while (!todo.isEmpty()) {
                String cur = todo.poll();
                Scan s = scans.get(cur);
                if (s == null) continue;
                if (!s.getStatus().isTerminal() && transitionLocked(cur, ScanStatus.CANCELLED, reason)) {
                    out.add(cur);
                }
                for (Scan child : scans.values()) {
                    if (cur.equals(child.getParentId())) todo.add(child.getId());
                }
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    /** 종단이 아닌 모든 스캔 취소(시간 제한/종료) */
    public int cancelAllActive(String reason) {
        lock.lock();
        try {
            int n = 0;
            for (Scan s : scans.values()) {
                if (!s.getStatus().isTerminal() && transitionLocked(s.getId(), ScanStatus.CANCELLED, reason)) n++;
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    /** 자동 튜닝 결과 반영(단조 감소는 호출자가 보장) */
    public void updateTuning(String id, int threads, int rate) {
        lock.lock();
        try {
            Scan s = scans.get(id);
            if (s == null) return;
            s.setThreadCount(threads);
            s.setRateLimit(rate);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /* =========================
       승인(Concurrency Governor 용)
       ========================= */

    /**
     * 여유 슬롯이 있으면 가장 먼저 등록된 QUEUED 스캔을 RUNNING 으로 올려 반환.
     * RUNNING + PAUSED 를 점유 슬롯으로 센다.
     * @param scanLimit 0 = 무제한
     */
    public Optional<Scan> tryAdmit(int scanLimit) {
        lock.lock();
        try {
            if (scanLimit > 0 && activeCountLocked() >= scanLimit) return Optional.empty();
            Scan next = null;
            for (Scan s : scans.values()) {
                if (s.getStatus() != ScanStatus.QUEUED) continue;
                if (next == null || FIFO.compare(s, next) < 0) next = s;
            }
            if (next == null) return Optional.empty();
            transitionLocked(next.getId(), ScanStatus.RUNNING, null);
            return Optional.of(next.copy());
        } finally {
            lock.unlock();
        }
    }

    /** 변경 신호 또는 타임아웃까지 대기. 신호를 받으면 true */
    public boolean awaitChange(long timeout, TimeUnit unit) throws InterruptedException {
        lock.lock();
        try {
            return changed.await(timeout, unit);
        } finally {
            lock.unlock();
        }
    }

    /** QUEUED/RUNNING/PAUSED 가 하나도 없음 */
    public boolean isQuiescent() {
        lock.lock();
        try {
            for (Scan s : scans.values()) {
                if (!s.getStatus().isTerminal()) return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasQueued() {
        lock.lock();
        try {
            for (Scan s : scans.values()) {
                if (s.getStatus() == ScanStatus.QUEUED) return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return activeCountLocked();
        } finally {
            lock.unlock();
        }
    }

    private int activeCountLocked() {
        int n = 0;
        for (Scan s : scans.values()) if (s.getStatus().isActive()) n++;
        return n;
    }

    /* =========================
       일시정지(Control Plane 용)
       ========================= */

    public int pauseRunning() {
        lock.lock();
        try {
            int n = 0;
            for (Scan s : scans.values()) {
                if (s.getStatus() == ScanStatus.RUNNING && transitionLocked(s.getId(), ScanStatus.PAUSED, null)) n++;
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    public int resumePaused() {
        lock.lock();
        try {
            int n = 0;
            for (Scan s : scans.values()) {
                if (s.getStatus() == ScanStatus.PAUSED && transitionLocked(s.getId(), ScanStatus.RUNNING, null)) n++;
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    /* =========================
       조회
       ========================= */

    public Optional<Scan> get(String id) {
        lock.lock();
        try {
            Scan s = scans.get(id);
            return s == null ? Optional.empty() : Optional.of(s.copy());
        } finally {
            lock.unlock();
        }
    }

    /** 락 없이 volatile 상태 한 번 읽기(요청 경계 체크용) */
    public boolean isCancelled(String id) {
        Scan s = live(id);
        return s == null || s.getStatus() == ScanStatus.CANCELLED;
    }

    /** 락 없이 현재 워커 예산 읽기 */
    public int currentThreads(String id) {
        Scan s = live(id);
        return s == null ? 1 : s.getThreadCount();
    }

    private Scan live(String id) {
        return id == null ? null : index.get(id);
    }

    public List<Scan> list(Predicate<Scan> filter) {
        lock.lock();
        try {
            List<Scan> out = new ArrayList<>();
            for (Scan s : scans.values()) {
                if (filter == null || filter.test(s)) out.add(s.copy());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    /** 등록 순 전체 스냅샷 */
    public List<Scan> snapshot() {
        return list(null);
    }

    /** 메뉴에 노출할 취소 가능 스캔: 부모가 있고 종단이 아님 */
    public List<Scan> cancelableScans() {
        return list(s -> s.getParentId() != null && !s.getStatus().isTerminal());
    }

    public Map<ScanStatus, Integer> counts() {
        lock.lock();
        try {
            Map<ScanStatus, Integer> out = new EnumMap<>(ScanStatus.class);
            for (ScanStatus st : ScanStatus.values()) out.put(st, 0);
            for (Scan s : scans.values()) out.merge(s.getStatus(), 1, Integer::sum);
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return scans.size();
        } finally {
            lock.unlock();
        }
    }

    /* =========================
       재개
       ========================= */

    /**
     * 저장된 스캔 목록으로 레지스트리를 채운다(기존 내용은 비움).
     * COMPLETE 는 그대로, 나머지는 QUEUED + 취소 사유 제거. 진행 위치는 보존하지 않는다.
     */
    public void reseed(List<Scan> saved) {
        lock.lock();
        try {
            scans.clear();
            index.clear();
            idByUrl.clear();
            List<Scan> sorted = new ArrayList<>(saved);
            sorted.sort(FIFO);
            long maxOrder = -1;
            for (Scan s : sorted) {
                boolean done = s.getStatus() == ScanStatus.COMPLETE;
                Scan copy = new Scan(s.getId(), s.getBaseUrl(), s.getScanType(), s.getParentId(), s.getDepth(),
                        s.getOrder(), done ? ScanStatus.COMPLETE : ScanStatus.QUEUED,
                        defaultThreads, defaultRate, null);
                scans.put(copy.getId(), copy);
                index.put(copy.getId(), copy);
                idByUrl.put(keyOf(copy.getBaseUrl()), copy.getId());
                maxOrder = Math.max(maxOrder, copy.getOrder());
            }
            seq = maxOrder + 1;
            changed.signalAll();
            LOG.info("Registry reseeded: {} scans ({} complete)", scans.size(),
                    scans.values().stream().filter(x -> x.getStatus() == ScanStatus.COMPLETE).count());
        } finally {
            lock.unlock();
        }
    }
}
