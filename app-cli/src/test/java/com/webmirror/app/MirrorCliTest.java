package com.webmirror.app;

import com.sun.net.httpserver.HttpServer;
import com.webmirror.app.report.CrawlReport;
import com.webmirror.app.report.CrawlReportIO;
import com.webmirror.core.model.PageOutcome;
import com.webmirror.core.model.PageResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
class MirrorCliTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    private final AtomicReference<Thread> hook = new AtomicReference<>();
    private final MirrorCli cli = new MirrorCli(
            new PrintStream(outBuf, true, StandardCharsets.UTF_8),
            new PrintStream(errBuf, true, StandardCharsets.UTF_8),
            hook::set);

    private String out() { return outBuf.toString(StandardCharsets.UTF_8); }
    private String err() { return errBuf.toString(StandardCharsets.UTF_8); }

    @Test
    void missing_url_is_fatal() {
        int code = cli.execute(new String[]{"--dir", tmp.toString()});

        assertEquals(1, code);
        assertTrue(err().contains("url flag is required"));
        assertNull(hook.get(), "no hook before a valid configuration");
    }

    @Test
    void non_http_url_is_fatal() {
        int code = cli.execute(new String[]{"--url", "ftp://github.com", "--dir", tmp.toString()});

        assertEquals(1, code);
        assertTrue(err().contains("invalid url provided"));
    }

    @Test
    void help_prints_usage_and_succeeds() {
        assertEquals(0, cli.execute(new String[]{"--help"}));
        assertTrue(out().contains("--url <seed>"));
        assertTrue(out().contains("--dir <path>"));
    }

    @Test
    void unknown_flag_prints_usage() {
        assertEquals(1, cli.execute(new String[]{"--bogus", "1"}));
        assertTrue(err().contains("unknown flag"));
        assertTrue(err().contains("Usage:"));
    }

    @Test
    void missing_config_file_is_fatal() {
        int code = cli.execute(new String[]{"--config", tmp.resolve("none.yml").toString()});
        assertEquals(1, code);
        assertTrue(err().contains("not found"));
    }

    @Test
    void mirrors_local_site_with_yaml_and_writes_report() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            String path = ex.getRequestURI().getPath();
            String html = switch (path) {
                case "/" -> "<a href=\"/guide\">guide</a><a href=\"https://elsewhere.test/\">x</a>";
                case "/guide" -> "<a href=\"/guide/intro\">intro</a><a href=\"/\">home</a>";
                case "/guide/intro" -> "<p>intro</p>";
                default -> null;
            };
            byte[] body = (html == null ? "" : html).getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(html == null ? 404 : 200, body.length == 0 ? -1 : body.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        try {
            String seed = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
            Path yml = Files.writeString(tmp.resolve("mirror.yml"),
                    "target: \"" + seed + "\"\nconcurrency: 2\n");
            Path mirror = tmp.resolve("site");
            Path report = tmp.resolve("out/report.json");

            int code = cli.execute(new String[]{
                    "--config", yml.toString(),
                    "--dir", mirror.toString(),
                    "--report", report.toString()});

            assertEquals(0, code);
            assertTrue(out().contains("done!"));
            assertFalse(out().contains("dir flag is empty"));
            assertTrue(Files.exists(mirror.resolve("index.html")));
            assertTrue(Files.exists(mirror.resolve("guide/guide.html")));
            assertTrue(Files.exists(mirror.resolve("guide/intro/intro.html")));

            CrawlReport r = new CrawlReportIO().read(report);
            assertEquals(mirror.toAbsolutePath().normalize().toString(), r.mirrorRoot);
            assertEquals(3, r.summary.stats().claimed());
            for (PageResult p : r.summary.pages()) {
                assertEquals(PageOutcome.FETCHED, p.outcome(), p.url());
            }

            // 정상 종료 후 훅이 돌아도 아무것도 하지 않는다
            hook.get().run();
            assertFalse(out().contains("stopping..."));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void interrupt_hook_cancels_crawl_without_summary_or_report() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            entered.countDown();
            try {
                release.await(20, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            byte[] body = "<a href=\"/more\">more</a>".getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(body);
            }
        });
        ExecutorService serverPool = Executors.newCachedThreadPool();
        server.setExecutor(serverPool);
        server.start();
        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            String seed = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
            Path mirror = tmp.resolve("site");
            Path report = tmp.resolve("report.json");

            Future<Integer> code = runner.submit(() -> cli.execute(new String[]{
                    "--url", seed, "--dir", mirror.toString(), "--report", report.toString()}));

            assertTrue(entered.await(10, TimeUnit.SECONDS), "seed request never arrived");
            assertNotNull(hook.get());
            hook.get().run();

            assertEquals(MirrorCli.EXIT_CANCELLED, code.get(20, TimeUnit.SECONDS));
            assertTrue(out().contains("stopping..."));
            assertFalse(out().contains("done!"));
            assertFalse(out().contains("mirrored"));
            assertFalse(Files.exists(report));
        } finally {
            release.countDown();
            runner.shutdownNow();
            server.stop(0);
            serverPool.shutdownNow();
        }
    }
}
