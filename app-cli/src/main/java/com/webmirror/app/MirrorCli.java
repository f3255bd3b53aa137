package com.webmirror.app;

import com.webmirror.app.logging.LogSetup;
import com.webmirror.app.report.CrawlReport;
import com.webmirror.app.report.CrawlReportIO;
import com.webmirror.core.model.CrawlSummary;
import com.webmirror.core.model.MirrorConfig;
import com.webmirror.core.service.MirrorService;
import com.webmirror.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 명령줄 진입점.
 * 종료 코드: 0 성공, 1 설정 오류, 2 리포트 쓰기 실패, 130 SIGINT로 취소됨.
 * 취소된 크롤은 요약/리포트/"done!"을 남기지 않는다.
 */
public final class MirrorCli {

    private static final Logger LOG = LoggerFactory.getLogger(MirrorCli.class);

    public static final int EXIT_CANCELLED = 130;

    private final PrintStream out;
    private final PrintStream err;
    private final Consumer<Thread> shutdownHooks;

    public MirrorCli(PrintStream out, PrintStream err) {
        this(out, err, Runtime.getRuntime()::addShutdownHook);
    }

    /** shutdownHooks: 훅 스레드 등록처(테스트에서는 붙잡아 직접 실행한다) */
    public MirrorCli(PrintStream out, PrintStream err, Consumer<Thread> shutdownHooks) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.shutdownHooks = Objects.requireNonNull(shutdownHooks, "shutdownHooks");
    }

    public static void main(String[] args) {
        LogSetup.init();
        int code = new MirrorCli(System.out, System.err).execute(args);
        // 셧다운 중 System.exit()는 블록되므로 취소된 경우는 그냥 반환
        if (code != EXIT_CANCELLED) {
            System.exit(code);
        }
    }

    /** SIGINT 시 "stopping..." 출력 후 크롤을 취소하는 훅을 등록하고 실행한다. */
    public int execute(String[] args) {
        CliArgs cli;
        try {
            cli = CliArgs.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliArgs.USAGE);
            return 1;
        }
        if (cli.help) {
            out.println(CliArgs.USAGE);
            return 0;
        }

        MirrorConfig cfg;
        try {
            cfg = (cli.config != null) ? YamlConfigLoader.read(cli.config) : MirrorConfig.defaults();
        } catch (IOException e) {
            LOG.error("Config load failed: {}", e.getMessage());
            err.println(e.getMessage());
            return 1;
        }
        cli.applyTo(cfg);

        if (!cfg.isOutputDirExplicit()) {
            out.println("dir flag is empty. using default " + MirrorConfig.DEFAULT_OUTPUT_DIR);
        }

        MirrorService service;
        try {
            service = new MirrorService(cfg);
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            err.println(e.getMessage());
            return 1;
        }

        shutdownHooks.accept(new Thread(() -> {
            if (!service.isFinished()) {
                out.println("stopping...");
                service.cancel();
            }
        }, "mirror-shutdown"));

        CrawlSummary summary = service.run();
        if (summary.cancelled()) {
            LOG.info("Mirror cancelled: pages={}, no report written", summary.stats().claimed());
            return EXIT_CANCELLED;
        }
        out.printf("mirrored %d page(s): %d fetched, %d cached, %d failed%n",
                summary.stats().claimed(), summary.stats().fetched(),
                summary.stats().cacheHits(), summary.stats().fetchFailures());

        if (cfg.getReportFile() != null) {
            try {
                new CrawlReportIO().write(
                        new CrawlReport(cfg.getOutputDir().toAbsolutePath().normalize().toString(), summary),
                        cfg.getReportFile());
                LOG.info("Report written: {}", cfg.getReportFile().toAbsolutePath());
            } catch (IOException e) {
                LOG.error("Report write failed: {}", cfg.getReportFile(), e);
                err.println("report write failed: " + e.getMessage());
                return 2;
            }
        }

        out.println("done!");
        return 0;
    }
}
