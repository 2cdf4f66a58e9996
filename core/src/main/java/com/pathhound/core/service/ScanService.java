package com.pathhound.core.service;

import com.pathhound.core.api.IHttpTransport;
import com.pathhound.core.api.IWordlist;
import com.pathhound.core.control.ControlPlane;
import com.pathhound.core.control.PauseController;
import com.pathhound.core.crawler.JsoupLinkExtractor;
import com.pathhound.core.crawler.robots.RobotsFetcher;
import com.pathhound.core.error.InvalidFilterException;
import com.pathhound.core.filter.FilterPipeline;
import com.pathhound.core.filter.FilterSet;
import com.pathhound.core.filter.FilterSetFactory;
import com.pathhound.core.filter.WildcardDetector;
import com.pathhound.core.http.DefaultRetryPolicy;
import com.pathhound.core.http.JdkHttpTransport;
import com.pathhound.core.http.Requester;
import com.pathhound.core.model.ExitStatus;
import com.pathhound.core.model.RunConfig;
import com.pathhound.core.model.ScanStats;
import com.pathhound.core.model.ScanType;
import com.pathhound.core.model.StateFile;
import com.pathhound.core.scan.RecursionPolicy;
import com.pathhound.core.scan.ScanRegistry;
import com.pathhound.core.state.ResponseStore;
import com.pathhound.core.state.ResumeValidator;
import com.pathhound.core.state.StatePersistence;
import com.pathhound.core.util.DefaultSleeper;
import com.pathhound.core.util.NamedThreadFactory;
import com.pathhound.core.util.ResponseListener;
import com.pathhound.core.util.Sleeper;
import com.pathhound.core.util.StructuredLog;
import com.pathhound.core.util.UrlExclusion;
import com.pathhound.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.PatternSyntaxException;

/**
 * 스캔 오케스트레이터: 실행 1회 = run() 1회.
 *
 * <ol>
 *   <li>구성 단계(생성자): 필터/제외 규칙 컴파일, 유사도 기준 페이지 수집. 실패는 즉시 예외</li>
 *   <li>run(): 타깃마다 INITIAL 스캔 등록 → 입장 관리 루프 → 결과 요약</li>
 *   <li>interrupt()/시간 제한: 모든 활성 스캔 취소 + 체크포인트 기록</li>
 * </ol>
 */
public class ScanService {
    private static final Logger LOG = LoggerFactory.getLogger(ScanService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanService.class);

    static final String USER_INTERRUPT_REASON = "user-interrupt";
    static final String TIME_LIMIT_REASON = "time-limit";

    private final RunConfig config;
    private final IWordlist wordlist;
    private final ScanRegistry registry;
    private final FilterSet filters;
    private final ResponseStore store = new ResponseStore();
    private final ScanStats stats = new ScanStats();
    private final PauseController pause = new PauseController();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Object stopLock = new Object();
    private final StatePersistence persistence = new StatePersistence();
    private final ScanContext ctx;
    private final LinkFollower linkFollower;

    private final Path statePath;
    private volatile ExitStatus exitStatus = ExitStatus.COMPLETED;
    private volatile Path lastCheckpoint;
    private volatile ControlPlane controlPlane;

    public ScanService(RunConfig config, IWordlist wordlist) {
        this(config, wordlist, new JdkHttpTransport(config), ResponseListener.NONE, new DefaultSleeper());
    }

    public ScanService(RunConfig config, IWordlist wordlist, IHttpTransport transport,
                       ResponseListener listener, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.wordlist = Objects.requireNonNull(wordlist, "wordlist");
        Objects.requireNonNull(transport, "transport");

        Requester requester = new Requester(transport,
                new DefaultRetryPolicy(config.getRetryAttempts(), 250), sleeper,
                config.getHeaders(), config.getQueries());
        this.filters = FilterSetFactory.create(config, transport);
        UrlExclusion exclusion = compileExclusions(config);
        this.registry = new ScanRegistry(config.getMaxDepth(), config.getThreads(), config.getRateLimit());
        RecursionPolicy recursion = new RecursionPolicy(config, registry, exclusion, config.getTargets());

        this.ctx = new ScanContext(config, wordlist, registry, requester, filters,
                FilterPipeline.from(config),
                new WildcardDetector(requester, filters, config.getWildcardTolerance()),
                recursion, exclusion, store,
                listener == null ? ResponseListener.NONE : listener,
                stats, pause, shutdown);
        this.linkFollower = new LinkFollower(ctx, new JsoupLinkExtractor(), new RobotsFetcher(requester));
        this.statePath = StatePersistence.defaultPath(config, Instant.now());
    }

    private static UrlExclusion compileExclusions(RunConfig cfg) {
        try {
            return UrlExclusion.compile(cfg.getDontScan());
        } catch (PatternSyntaxException e) {
            throw new InvalidFilterException("invalid dont-scan pattern: " + e.getPattern(), e);
        }
    }

    /**
     * 저장된 상태에서 재개할 서비스를 만든다.
     * 현재 설정의 타깃이 비어 있으면 저장된 타깃을 쓴다. COMPLETE 스캔은 다시 돌지 않는다.
     */
    public static ScanService resume(Path stateFile, RunConfig current, IWordlist wordlist,
                                     IHttpTransport transport, ResponseListener listener, Sleeper sleeper) {
        StateFile saved = new StatePersistence().load(stateFile);
        ResumeValidator.ensureCompatible(saved, current, wordlist);

        RunConfig effective = current.getTargets().isEmpty()
                ? current.toBuilder().targets(saved.config.getTargets()).build()
                : current;

        ScanService svc = new ScanService(effective, wordlist, transport, listener, sleeper);
        svc.registry.reseed(saved.scans);
        svc.store.preload(saved.responses);
        LOG.info("Resuming from {} (saved {}): {} scans, {} responses",
                stateFile, saved.savedAt, saved.scans.size(), saved.responses.size());
        SLOG.info("resume", "file", stateFile.toString(), "scans", saved.scans.size(),
                "responses", saved.responses.size());
        return svc;
    }

    public static ScanService resume(Path stateFile, RunConfig current, IWordlist wordlist) {
        return resume(stateFile, current, wordlist, new JdkHttpTransport(current),
                ResponseListener.NONE, new DefaultSleeper());
    }

    /* =========================
       실행
       ========================= */

    public RunOutcome run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("ScanService can only run once");
        }
        if (registry.size() == 0) seedTargets();

        LOG.info("Run start: {} target(s), {} words, threads={}, scanLimit={}, rate={}, depth={}",
                config.getTargets().size(), wordlist.size(), config.getThreads(),
                config.getScanLimit() == 0 ? "unlimited" : config.getScanLimit(),
                config.getRateLimit() == 0 ? "unlimited" : config.getRateLimit(),
                config.getMaxDepth() == 0 ? "unlimited" : config.getMaxDepth());
        SLOG.info("run-start", "targets", config.getTargets().size(), "words", wordlist.size(),
                "scans", registry.size());

        ScheduledExecutorService timer = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("state-timer"));
        TimeLimitWatchdog watchdog = null;
        long t0 = System.nanoTime();
        try {
            if (config.hasTimeLimit()) {
                watchdog = new TimeLimitWatchdog(timer, config.getTimeLimit(), this::onTimeLimit);
                watchdog.start();
            }
            long every = config.getStateInterval().toMillis();
            if (!config.isNoState() && every > 0) {
                timer.scheduleAtFixedRate(this::periodicCheckpoint, every, every, TimeUnit.MILLISECONDS);
            }

            new ConcurrencyGovernor(registry, config.getScanLimit(), pause, shutdown,
                    scan -> new ScanExecution(scan, ctx, linkFollower)).run();
            synchronized (stopLock) {
                // 진행 중인 stop() 대기
                LOG.debug("Admission loop finished (shutdown={})", shutdown.get());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            stop(USER_INTERRUPT_REASON, ExitStatus.USER_CANCELLED);
        } finally {
            if (watchdog != null) watchdog.cancel();
            timer.shutdownNow();
            ControlPlane cp = controlPlane;
            if (cp != null) cp.close();
        }

        long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        ScanStats.Snapshot snap = stats.snapshot();
        LOG.info("Run finished in {} ms: exit={}, accepted={}, dropped={}, errors={}, requests={}",
                ms, exitStatus, snap.accepted, snap.dropped, snap.errors, snap.requestsTotal);
        SLOG.info("run-done", "ms", ms, "exit", exitStatus.code(), "accepted", snap.accepted,
                "dropped", snap.dropped, "errors", snap.errors, "requests", snap.requestsTotal,
                "scans", registry.counts());
        return new RunOutcome(exitStatus, snap, store.all(), registry.snapshot(), lastCheckpoint);
    }

    private void seedTargets() {
        for (String t : config.getTargets()) {
            registry.registerIfAbsent(UrlUtils.directoryBase(t), ScanType.INITIAL, null, 0);
        }
    }

    /** 사용자 중단(SIGINT). 활성 스캔을 모두 취소하고 체크포인트를 남긴다 */
    public void interrupt() {
        stop(USER_INTERRUPT_REASON, ExitStatus.USER_CANCELLED);
    }

    private void onTimeLimit() {
        LOG.warn("Time limit {} reached; stopping all scans", config.getTimeLimit());
        stop(TIME_LIMIT_REASON, ExitStatus.TIME_LIMIT);
    }

    /** 종료 플래그는 락 안에서 세우므로, 승인 루프가 끝난 뒤 stopLock 을 잡으면 체크포인트까지 끝나 있다 */
    private void stop(String reason, ExitStatus status) {
        synchronized (stopLock) {
            if (shutdown.get()) return;
            exitStatus = status;
            int n = registry.cancelAllActive(reason);
            shutdown.set(true);
            pause.resume();
            SLOG.warn("shutdown", "reason", reason, "cancelled", n);
            try {
                checkpoint();
            } catch (RuntimeException e) {
                LOG.error("Final checkpoint failed: {}", e.toString(), e);
            }
        }
    }

    /* =========================
       상태 저장
       ========================= */

    /** 현재 상태를 상태 파일로 기록. noState 이면 아무 것도 쓰지 않는다 */
    public synchronized Optional<Path> checkpoint() {
        if (config.isNoState()) return Optional.empty();
        StateFile s = new StateFile();
        s.savedAt = Instant.now();
        s.wordlistEntries = wordlist.size();
        s.scans = registry.snapshot();
        s.config = config;
        s.responses = store.all();
        persistence.save(s, statePath);
        lastCheckpoint = statePath;
        LOG.info("State saved to {}", statePath.toAbsolutePath());
        SLOG.info("checkpoint", "file", statePath.toString(), "scans", s.scans.size(),
                "responses", s.responses.size());
        return Optional.of(statePath);
    }

    private void periodicCheckpoint() {
        try {
            checkpoint();
        } catch (RuntimeException e) {
            LOG.warn("Periodic checkpoint failed: {}", e.toString());
        }
    }

    /* =========================
       대화형 제어
       ========================= */

    public synchronized ControlPlane attachControlPlane(InputStream in, PrintStream out) {
        if (controlPlane == null) {
            controlPlane = new ControlPlane(registry, pause, in, out);
            controlPlane.start();
        }
        return controlPlane;
    }

    public RunConfig config() { return config; }
    public ScanRegistry registry() { return registry; }
    public FilterSet filters() { return filters; }
    public PauseController pauseController() { return pause; }
    public ScanStats.Snapshot stats() { return stats.snapshot(); }
    public Path statePath() { return statePath; }
    public ExitStatus exitStatus() { return exitStatus; }
}
