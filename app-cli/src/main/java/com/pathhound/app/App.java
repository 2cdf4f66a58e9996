package com.pathhound.app;

import com.pathhound.app.logging.LogSetup;
import com.pathhound.core.config.YamlConfigLoader;
import com.pathhound.core.http.JdkHttpTransport;
import com.pathhound.core.model.ExitStatus;
import com.pathhound.core.model.RunConfig;
import com.pathhound.core.service.RunOutcome;
import com.pathhound.core.service.ScanService;
import com.pathhound.core.util.DefaultSleeper;
import com.pathhound.core.util.ResponseListener;
import com.pathhound.core.util.Wordlist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;

/** 명령행 진입점. 통과 응답은 stdout 한 줄씩, 로그는 stderr + 파일 */
public final class App {
    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    private App() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        CliArgs cli = new CliArgs();
        CommandLine cl = new CommandLine(cli);
        try {
            cl.parseArgs(args);
        } catch (CommandLine.ParameterException e) {
            System.err.println(e.getMessage());
            cl.usage(System.err);
            return ExitStatus.FATAL.code();
        }
        if (cl.isUsageHelpRequested()) {
            cl.usage(out);
            return ExitStatus.COMPLETED.code();
        }
        if (cl.isVersionHelpRequested()) {
            cl.printVersionHelp(out);
            return ExitStatus.COMPLETED.code();
        }

        ScanService svc;
        try {
            RunConfig cfg = effectiveConfig(cli);
            LogSetup.configure(Path.of(cfg.getOutputDir()));
            if (cli.verbose) LogSetup.setLevel(Level.FINE);

            Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                    LOG.error("==== Uncaught: {} ====", t.getName(), e));

            if (cfg.getWordlist() == null) {
                throw new IllegalArgumentException("no wordlist given (-w or 'wordlist:' in config)");
            }
            Wordlist words = Wordlist.fromFile(Path.of(cfg.getWordlist()));
            ResponseListener printer = r -> {
                synchronized (out) {
                    out.println(r);
                }
            };

            if (cli.resumeFrom != null) {
                svc = ScanService.resume(cli.resumeFrom, cfg, words, new JdkHttpTransport(cfg), printer,
                        new DefaultSleeper());
            } else {
                if (cfg.getTargets().isEmpty()) {
                    throw new IllegalArgumentException("no target given (-u or 'targets:' in config)");
                }
                svc = new ScanService(cfg, words, new JdkHttpTransport(cfg), printer, new DefaultSleeper());
            }
        } catch (IOException | RuntimeException e) {
            LOG.error("Startup failed: {}", e.getMessage());
            System.err.println("error: " + e.getMessage());
            return ExitStatus.FATAL.code();
        }

        // Ctrl-C: 활성 스캔 취소 + 상태 저장
        AtomicBoolean finished = new AtomicBoolean(false);
        final ScanService service = svc;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (!finished.get()) {
                LOG.warn("Interrupted; saving state");
                service.interrupt();
            }
        }, "shutdown-hook"));

        if (cli.interactive()) {
            svc.attachControlPlane(System.in, System.err);
        }

        RunOutcome outcome = svc.run();
        finished.set(true);

        if (outcome.stateFile() != null) {
            System.err.println("state saved: " + outcome.stateFile().toAbsolutePath());
        }
        LOG.info("Done: {} response(s), {} request(s), exit {}",
                outcome.responses().size(), outcome.stats().requestsTotal, outcome.exitStatus().code());
        return outcome.exitStatus().code();
    }

    /** scan.yml(있으면) + 명령행 덮어쓰기. 헤더/쿼리는 파일 값에 더해진다 */
    static RunConfig effectiveConfig(CliArgs cli) throws IOException {
        RunConfig base;
        Path config = cli.configPath();
        if (Files.exists(config)) {
            base = YamlConfigLoader.load(config);
        } else if (cli.configExplicit()) {
            throw new IOException("config not found: " + config.toAbsolutePath());
        } else {
            base = RunConfig.defaults();
        }
        RunConfig.Builder b = base.toBuilder();
        if (!cli.urls.isEmpty()) b.targets(cli.urls);
        if (cli.wordlist != null) b.wordlist(cli.wordlist);
        cli.headerMap().forEach(b::header);
        if (!cli.queries.isEmpty()) {
            List<String> queries = new ArrayList<>(base.getQueries());
            queries.addAll(cli.queries);
            b.queries(queries);
        }
        return b.build();
    }
}
