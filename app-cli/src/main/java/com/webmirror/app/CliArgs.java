package com.webmirror.app;

import com.webmirror.core.model.MirrorConfig;

import java.nio.file.Path;
import java.util.Locale;

/**
 * 명령줄 플래그. "--flag value", "--flag=value", "-flag value" 모두 허용.
 * 지정된 값만 MirrorConfig에 덮어쓴다(YAML 위에 얹는 용도).
 */
final class CliArgs {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: webmirror --url <seed> [options]",
            "  --url <seed>          seed url (required, http/https)",
            "  --dir <path>          mirror root directory (default ./data)",
            "  --config <file>       mirror.yml to read before applying flags",
            "  --concurrency <n>     worker pool size, 0 = unbounded (default 0)",
            "  --timeout-ms <n>      per-request timeout in ms, 0 = none (default 0)",
            "  --report <file>       write a JSON crawl report",
            "  --help                print this help");

    String url;
    Path dir;
    Path config;
    Integer concurrency;
    Long timeoutMs;
    Path report;
    boolean help;

    private CliArgs() {}

    /** @throws IllegalArgumentException 알 수 없는 플래그, 값 누락, 숫자 형식 오류 */
    static CliArgs parse(String[] args) {
        CliArgs a = new CliArgs();
        if (args == null) return a;

        for (int i = 0; i < args.length; i++) {
            String tok = args[i];
            if (!tok.startsWith("-")) {
                throw new IllegalArgumentException("unexpected argument: " + tok);
            }
            String name = tok.startsWith("--") ? tok.substring(2) : tok.substring(1);
            String value = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            name = name.toLowerCase(Locale.ROOT);

            if (name.equals("help") || name.equals("h")) {
                a.help = true;
                continue;
            }
            if (value == null) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for flag: " + tok);
                }
                value = args[++i];
            }

            switch (name) {
                case "url" -> a.url = value;
                case "dir" -> a.dir = value.isBlank() ? null : Path.of(value.trim());
                case "config" -> a.config = Path.of(value.trim());
                case "concurrency" -> a.concurrency = parseInt(name, value);
                case "timeout-ms" -> a.timeoutMs = parseLong(name, value);
                case "report" -> a.report = Path.of(value.trim());
                default -> throw new IllegalArgumentException("unknown flag: " + tok);
            }
        }
        return a;
    }

    /** 지정된 플래그만 덮어쓴다. */
    MirrorConfig applyTo(MirrorConfig cfg) {
        if (url != null) cfg.setTarget(url);
        if (dir != null) cfg.setOutputDir(dir);
        if (concurrency != null) cfg.setConcurrency(concurrency);
        if (timeoutMs != null) cfg.setRequestTimeoutMs(timeoutMs);
        if (report != null) cfg.setReportFile(report);
        return cfg;
    }

    private static int parseInt(String flag, String v) {
        try { return Integer.parseInt(v.trim()); }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + flag + " expects a number, got: " + v, e);
        }
    }

    private static long parseLong(String flag, String v) {
        try { return Long.parseLong(v.trim()); }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + flag + " expects a number, got: " + v, e);
        }
    }
}
