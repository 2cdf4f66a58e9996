package com.pathhound.app;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 명령행 인자 (picocli).
 * <pre>
 * pathhound [-c scan.yml] [-u URL]... [-w wordlist] [-H "Name: value"]... [-Q name=value]...
 *           [--resume-from FILE] [--no-menu] [-v]
 * </pre>
 * 명령행 값은 scan.yml 값을 덮어쓴다.
 */
@Command(
    name = "pathhound",
    description = "Forced-browsing content discovery driven by a wordlist",
    mixinStandardHelpOptions = true,
    version = "pathhound 0.3.0",
    sortOptions = false
)
final class CliArgs {
    static final Path DEFAULT_CONFIG = Path.of("scan.yml");

    @Option(names = {"-c", "--config"}, paramLabel = "FILE",
            description = "Run configuration (default: scan.yml)")
    Path config;

    @Option(names = {"-u", "--url"}, paramLabel = "URL",
            description = "Target URL, repeatable (overrides config targets)")
    List<String> urls = new ArrayList<>();

    @Option(names = {"-w", "--wordlist"}, paramLabel = "FILE",
            description = "Wordlist path (overrides config)")
    String wordlist;

    @Option(names = {"-H", "--header"}, paramLabel = "NAME: VALUE",
            description = "Extra request header, repeatable (added to config headers)")
    List<String> headers = new ArrayList<>();

    @Option(names = {"-Q", "--query"}, paramLabel = "NAME=VALUE",
            description = "Query parameter appended to every request, repeatable")
    List<String> queries = new ArrayList<>();

    @Option(names = "--resume-from", paramLabel = "FILE",
            description = "Resume from a saved state file")
    Path resumeFrom;

    @Option(names = "--no-menu",
            description = "Do not listen on stdin for pause/cancel")
    boolean noMenu;

    @Option(names = {"-v", "--verbose"}, description = "Debug logging")
    boolean verbose;

    /** @throws CommandLine.ParameterException 알 수 없는 옵션, 값 누락 */
    static CliArgs parse(String[] args) {
        CliArgs a = new CliArgs();
        new CommandLine(a).parseArgs(args);
        return a;
    }

    Path configPath() {
        return config == null ? DEFAULT_CONFIG : config;
    }

    boolean configExplicit() {
        return config != null;
    }

    boolean interactive() {
        return !noMenu;
    }

    /** "Name: value" 목록을 헤더 맵으로. 같은 이름은 뒤의 값이 이긴다 */
    Map<String, String> headerMap() {
        Map<String, String> out = new LinkedHashMap<>();
        for (String h : headers) {
            int colon = h.indexOf(':');
            if (colon <= 0) throw new IllegalArgumentException("header must be 'Name: value': " + h);
            out.put(h.substring(0, colon).trim(), h.substring(colon + 1).trim());
        }
        return out;
    }
}
