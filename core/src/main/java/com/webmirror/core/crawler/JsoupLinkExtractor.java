package com.webmirror.core.crawler;

import com.webmirror.core.model.CrawlTarget;
import com.webmirror.core.model.NormalizedUrl;
import com.webmirror.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.NodeTraversor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** JSoup 기반 링크 추출기: DOM을 깊이 우선으로 돌며 a[href] 수집 → 정규화 → 범위 필터 */
public class JsoupLinkExtractor implements LinkExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(JsoupLinkExtractor.class);

    private final CrawlTarget target;

    public JsoupLinkExtractor(CrawlTarget target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    @Override
    public List<String> extract(NormalizedUrl page, boolean directory, byte[] body) {
        if (body == null || body.length == 0) return List.of();
        String baseUri = (directory ? page.toDirectoryUri() : page.toUri()).toString();
        Document doc;
        try {
            // charset은 meta 태그 기준, 없으면 UTF-8
            doc = Jsoup.parse(new ByteArrayInputStream(body), null, baseUri);
        } catch (IOException e) {
            LOG.warn("HTML parse failed: {} ({})", page, e.toString());
            return List.of();
        }
        return extract(doc, page, directory);
    }

    private List<String> extract(Document doc, NormalizedUrl page, boolean directory) {
        // 키 → 내보낼 형태(디렉터리 형태면 끝 "/" 유지). 첫 등장 형태를 쓴다.
        Map<String, String> out = new LinkedHashMap<>();
        NodeTraversor.traverse((node, depth) -> {
            if (!(node instanceof Element el)) return;
            if (!"a".equals(el.normalName()) || !el.hasAttr("href")) return;

            String href = el.attr("href");
            UrlUtils.normalize(href, page, directory)
                    .filter(u -> ScopeFilter.inScope(u, target))
                    // 자기 자신/범위 루트로 돌아가는 링크 제외
                    .filter(u -> !u.path().equals(target.scopePath()) && !u.path().equals(page.path()))
                    .ifPresent(u -> out.putIfAbsent(u.key(),
                            UrlUtils.isDirectoryForm(href) ? u.key() + "/" : u.key()));
        }, doc);

        LOG.debug("extracted {} link(s) from {}", out.size(), page);
        return List.copyOf(out.values());
    }
}
