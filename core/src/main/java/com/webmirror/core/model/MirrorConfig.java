package com.webmirror.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 미러링 설정 (mirror.yml / CLI 플래그 매핑 대상). 순수 설정 보관용.
 * 병합 순서(YAML → CLI 플래그)는 호출자 책임.
 */
public final class MirrorConfig {

    /** --dir 미지정 시 기본 미러 루트 */
    public static final Path DEFAULT_OUTPUT_DIR = Path.of("./data");

    // ---------- 필드 ----------
    private String target;                       // 시드 URL (필수)
    private Path outputDir = DEFAULT_OUTPUT_DIR; // 미러 루트
    private boolean outputDirExplicit = false;   // 사용자가 직접 지정했는지

    /** 0 이하 = 상한 없음(링크마다 작업 하나). 양수면 고정 크기 풀. */
    private int concurrency = 0;

    /** 요청 타임아웃. null = 무제한 */
    private Duration requestTimeout = null;

    private boolean followRedirects = true;

    /** 크롤 요약 JSON 경로. null = 쓰지 않음 */
    private Path reportFile = null;

    public static MirrorConfig defaults() {
        return new MirrorConfig();
    }

    // ---------- getters ----------
    public String getTarget() { return target; }
    public Path getOutputDir() { return outputDir; }
    public boolean isOutputDirExplicit() { return outputDirExplicit; }
    public int getConcurrency() { return concurrency; }
    public boolean isUnbounded() { return concurrency <= 0; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public Path getReportFile() { return reportFile; }

    // ---------- fluent setters ----------
    public MirrorConfig setTarget(String target) {
        this.target = (target == null ? null : target.trim());
        return this;
    }

    public MirrorConfig setOutputDir(Path outputDir) {
        if (outputDir != null) {
            this.outputDir = outputDir;
            this.outputDirExplicit = true;
        }
        return this;
    }

    public MirrorConfig setConcurrency(int concurrency) {
        this.concurrency = Math.max(0, concurrency);
        return this;
    }

    public MirrorConfig setRequestTimeout(Duration timeout) {
        this.requestTimeout = (timeout == null || timeout.isZero() || timeout.isNegative()) ? null : timeout;
        return this;
    }

    public MirrorConfig setRequestTimeoutMs(long ms) {
        return setRequestTimeout(ms > 0 ? Duration.ofMillis(ms) : null);
    }

    public MirrorConfig setFollowRedirects(boolean v) {
        this.followRedirects = v;
        return this;
    }

    public MirrorConfig setReportFile(Path reportFile) {
        this.reportFile = reportFile;
        return this;
    }

    // ---------- validate ----------

    /**
     * 필수값 확인. 시드가 없거나 http(s)가 아니면 크롤을 시작할 수 없다.
     *
     * @throws IllegalArgumentException 시드 누락/형식 오류
     */
    public void validate() {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("url flag is required");
        }
        CrawlTarget.fromSeed(target); // 파싱 불가 시 IllegalArgumentException
        Objects.requireNonNull(outputDir, "outputDir");
    }

    @Override
    public String toString() {
        return "MirrorConfig{target=" + target
                + ", outputDir=" + outputDir
                + ", concurrency=" + (isUnbounded() ? "unbounded" : String.valueOf(concurrency))
                + ", requestTimeout=" + (requestTimeout == null ? "none" : requestTimeout.toMillis() + "ms")
                + ", followRedirects=" + followRedirects
                + ", report=" + reportFile + "}";
    }
}
