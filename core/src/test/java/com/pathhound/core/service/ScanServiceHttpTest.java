package com.pathhound.core.service;

import com.pathhound.core.model.ExitStatus;
import com.pathhound.core.model.RunConfig;
import com.pathhound.core.model.Scan;
import com.pathhound.core.model.ScanResponse;
import com.pathhound.core.model.ScanStatus;
import com.pathhound.core.util.Wordlist;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/** 실제 HttpClient 경로로 로컬 서버를 스캔 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class ScanServiceHttpTest {

    static HttpServer s;
    static String base;

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        base = "http://127.0.0.1:" + s.getAddress().getPort() + "/";

        s.createContext("/", ex -> {
            String path = ex.getRequestURI().getRawPath();
            switch (path) {
                case "/admin" -> {
                    ex.getResponseHeaders().add("Location", "/admin/");
                    ex.sendResponseHeaders(301, -1);
                    ex.close();
                }
                case "/admin/" -> respond(ex, 403, "forbidden");
                case "/admin/login.php" -> respond(ex, 200, "<form action=\"/admin/auth\"></form>");
                case "/index.html" -> respond(ex, 200, "<html><body>welcome</body></html>");
                default -> respond(ex, 404, "not here");
            }
        });
        s.start();
    }

    @AfterAll
    static void down() {
        if (s != null) s.stop(0);
    }

    private static void respond(HttpExchange ex, int status, String body) throws IOException {
        byte[] b = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        ex.sendResponseHeaders(status, b.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(b);
        }
    }

    @Test
    void scans_local_server_and_recurses_into_admin() {
        RunConfig cfg = RunConfig.builder()
                .target(base)
                .threads(3)
                .maxDepth(2)
                .timeout(Duration.ofSeconds(5))
                .noState(true)
                .build();

        RunOutcome out = new ScanService(cfg, Wordlist.of("admin", "index.html", "login.php")).run();

        assertThat(out.exitStatus()).isEqualTo(ExitStatus.COMPLETED);
        assertThat(out.responses()).extracting(ScanResponse::getPath)
                .containsExactlyInAnyOrder("/admin", "/index.html", "/admin/login.php");
        assertThat(out.scans()).extracting(Scan::getBaseUrl)
                .containsExactlyInAnyOrder(base, base + "admin/");
        assertThat(out.scans()).allMatch(sc -> sc.getStatus() == ScanStatus.COMPLETE);
        assertThat(out.stats().errors).isZero();
        assertThat(out.stateFile()).isNull();
        assertThat(out.responses()).noneMatch(ScanResponse::isWildcard);
    }
}
