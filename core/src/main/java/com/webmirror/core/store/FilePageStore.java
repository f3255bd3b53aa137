package com.webmirror.core.store;

import com.webmirror.core.api.IPageStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * 로컬 디렉터리 트리 위의 페이지 저장소.
 * 레이아웃: {@code <root><urlPath>/<basename>.html}
 * <ul>
 *   <li>"/docs/a" → root/docs/a/a.html</li>
 *   <li>"" (루트) → root/index.html</li>
 * </ul>
 * 같은 경로에 대한 동시 쓰기는 방문 집합 선점(claim)이 막아 주므로 별도 락은 없다.
 */
public final class FilePageStore implements IPageStore {

    public static final String INDEX_NAME = "index";
    public static final String EXTENSION = ".html";

    private final Path root;

    public FilePageStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    @Override
    public Path locate(String urlPath) throws StoreException {
        String p = (urlPath == null ? "" : urlPath);
        String rel = trimSlashes(p);
        String basename = (rel.isEmpty() || p.endsWith("/"))
                ? INDEX_NAME
                : rel.substring(rel.lastIndexOf('/') + 1);
        try {
            Path dir = rel.isEmpty() ? root : root.resolve(rel);
            Path file = dir.resolve(basename + EXTENSION).normalize();
            if (!file.startsWith(root)) {
                throw new StoreException("path escapes mirror root: " + urlPath);
            }
            return file;
        } catch (InvalidPathException e) {
            throw new StoreException("invalid path for mirror: " + urlPath, e);
        }
    }

    @Override
    public Optional<byte[]> load(String urlPath) throws StoreException {
        Path file = locate(urlPath);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreException("read failed: " + file, e);
        }
    }

    @Override
    public Path save(String urlPath, byte[] content) throws StoreException {
        Path file = locate(urlPath);
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, content == null ? new byte[0] : content,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return file;
        } catch (IOException e) {
            throw new StoreException("write failed: " + file, e);
        }
    }

    private static String trimSlashes(String s) {
        int from = 0, to = s.length();
        while (from < to && s.charAt(from) == '/') from++;
        while (to > from && s.charAt(to - 1) == '/') to--;
        return s.substring(from, to);
    }
}
