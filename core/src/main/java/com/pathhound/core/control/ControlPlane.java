package com.pathhound.core.control;

import com.pathhound.core.model.Scan;
import com.pathhound.core.scan.ScanRegistry;
import com.pathhound.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * 대화형 일시정지/취소 리스너.
 * <ol>
 *   <li>빈 줄 또는 "p" → 일시정지 + 취소 메뉴 출력</li>
 *   <li>일시정지 중 입력 → 선택 스캔(및 후손) 취소 후 재개</li>
 * </ol>
 * 입력 스트림이 끝나면 스레드도 끝난다.
 */
public final class ControlPlane implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(ControlPlane.class);
    private static final StructuredLog SLOG = StructuredLog.get(ControlPlane.class);

    private final ScanRegistry registry;
    private final PauseController pause;
    private final InputStream in;
    private final PrintStream out;
    private volatile boolean closed;
    private volatile List<Scan> shown = List.of();
    private Thread thread;

    public ControlPlane(ScanRegistry registry, PauseController pause, InputStream in, PrintStream out) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.pause = Objects.requireNonNull(pause, "pause");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    public synchronized void start() {
        if (thread != null) return;
        thread = new Thread(this::loop, "control-plane");
        thread.setDaemon(true);
        thread.start();
    }

    private void loop() {
        try (BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while (!closed && (line = r.readLine()) != null) {
                if (!pause.isPaused()) {
                    String cmd = line.trim();
                    if (cmd.isEmpty() || cmd.equalsIgnoreCase("p")) {
                        openMenu();
                    }
                } else {
                    cancelAndResume(line);
                }
            }
        } catch (IOException e) {
            if (!closed) LOG.warn("Control input closed: {}", e.toString());
        }
    }

    /** 일시정지 후 메뉴를 출력하고, 표시한 목록을 돌려준다 */
    public List<Scan> openMenu() {
        pause.pause();
        int n = registry.pauseRunning();
        List<Scan> list = registry.cancelableScans();
        shown = list;
        SLOG.info("paused", "scansPaused", n, "cancelable", list.size());
        out.println();
        out.print(CancelMenu.render(list));
        out.flush();
        return list;
    }

    /** 메뉴 선택을 적용하고 재개. 취소된 스캔 수 반환 */
    public int cancelAndResume(String selection) {
        List<Scan> list = shown;
        List<Integer> picked = CancelMenu.parseSelection(selection, list.size(), msg -> out.println("  " + msg));
        int cancelled = CancelMenu.apply(registry, list, picked);
        if (cancelled > 0) {
            out.println("  cancelled " + cancelled + " scan(s)");
            LOG.info("Cancelled {} scan(s) from menu: {}", cancelled, picked);
        }
        shown = List.of();
        registry.resumePaused();
        pause.resume();
        SLOG.info("resumed", "cancelled", cancelled);
        out.flush();
        return cancelled;
    }

    @Override
    public void close() {
        closed = true;
        if (pause.isPaused()) {
            registry.resumePaused();
            pause.resume();
        }
    }
}
