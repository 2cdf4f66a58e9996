package com.pathhound.core.state;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pathhound.core.error.StateFileException;
import com.pathhound.core.model.RunConfig;
import com.pathhound.core.model.StateFile;
import com.pathhound.core.util.UrlUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Objects;

/**
 * 상태 파일 입출력.
 * 쓰기는 같은 디렉터리의 임시 파일에 쓴 뒤 원자적 rename 으로 교체한다
 * (원자적 이동 미지원 파일시스템이면 일반 교체).
 */
public final class StatePersistence {
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    public void save(StateFile state, Path file) {
        if (state == null) throw new IllegalArgumentException("state is null");
        Objects.requireNonNull(file, "file");
        Path abs = file.toAbsolutePath();
        Path dir = abs.getParent();
        Path tmp = null;
        try {
            if (dir != null) Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, abs.getFileName().toString(), ".tmp");
            om.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, abs, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (tmp != null) {
                try { Files.deleteIfExists(tmp); } catch (IOException suppressed) { e.addSuppressed(suppressed); }
            }
            throw new StateFileException("failed to write state file " + abs, e);
        }
    }

    public StateFile load(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new StateFileException("state file not found: " + file.toAbsolutePath());
        }
        StateFile s;
        try {
            s = om.readValue(file.toFile(), StateFile.class);
        } catch (IOException e) {
            throw new StateFileException("state file unreadable: " + file.toAbsolutePath(), e);
        }
        if (s == null || !"1".equals(s.v)) {
            throw new StateFileException("unsupported state file version: " + (s == null ? null : s.v));
        }
        if (s.config == null || s.scans == null) {
            throw new StateFileException("state file is missing scans or config: " + file.toAbsolutePath());
        }
        return s;
    }

    /** &lt;outputDir&gt;/pathhound-&lt;host&gt;-&lt;epochSeconds&gt;.state */
    public static Path defaultPath(RunConfig cfg, Instant now) {
        String host = "scan";
        if (!cfg.getTargets().isEmpty()) {
            String h = UrlUtils.hostOf(URI.create(cfg.getTargets().get(0)));
            if (!h.isEmpty()) host = h.replaceAll("[^a-zA-Z0-9._-]", "_");
        }
        return Path.of(cfg.getOutputDir()).resolve("pathhound-" + host + "-" + now.getEpochSecond() + ".state");
    }
}
