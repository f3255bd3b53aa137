package com.webmirror.core.util;

import com.webmirror.core.model.NormalizedUrl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class UrlUtilsTest {

    private static final NormalizedUrl BASE = new NormalizedUrl("https", "github.com", "/features/page");

    private static String keyOf(Optional<NormalizedUrl> u) {
        return u.map(NormalizedUrl::key).orElse(null);
    }

    @Nested
    @DisplayName("절대 URL 파싱")
    class ParseAbsolute {

        @Test
        void lowercases_scheme_and_host_and_drops_default_port() {
            assertThat(keyOf(UrlUtils.parseAbsolute("HTTPS://GitHub.com:443/Features/")))
                    .isEqualTo("https://github.com/Features");
            assertThat(keyOf(UrlUtils.parseAbsolute("http://example.com:80")))
                    .isEqualTo("http://example.com");
        }

        @Test
        void keeps_non_default_port_in_host() {
            NormalizedUrl u = UrlUtils.parseAbsolute("http://127.0.0.1:8080/docs").orElseThrow();
            assertThat(u.host()).isEqualTo("127.0.0.1:8080");
            assertThat(u.path()).isEqualTo("/docs");
        }

        @Test
        void strips_query_fragment_and_trailing_slash() {
            assertThat(keyOf(UrlUtils.parseAbsolute("https://github.com/features/?tab=1#top")))
                    .isEqualTo("https://github.com/features");
        }

        @Test
        void root_path_is_empty() {
            NormalizedUrl u = UrlUtils.parseAbsolute("https://github.com/").orElseThrow();
            assertThat(u.path()).isEmpty();
            assertThat(u.isRoot()).isTrue();
            assertThat(u.key()).isEqualTo("https://github.com");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "ftp://x.com/a", "github.com/features", "http://", "https://a.com/../x", "http://a b.com/"})
        void rejects_unusable_input(String raw) {
            assertThat(UrlUtils.parseAbsolute(raw)).isEmpty();
        }
    }

    @Nested
    @DisplayName("href 정규화")
    class Normalize {

        @ParameterizedTest
        @ValueSource(strings = {"#", "#top", "/", "", "  ", "mailto:a@b.com", "javascript:void(0)", "tel:123"})
        void discards_sentinels_fragments_and_foreign_schemes(String href) {
            assertThat(UrlUtils.normalize(href, BASE)).isEmpty();
        }

        @Test
        void absolute_same_host_is_kept_other_host_discarded() {
            assertThat(keyOf(UrlUtils.normalize("https://github.com/features/b", BASE)))
                    .isEqualTo("https://github.com/features/b");
            assertThat(UrlUtils.normalize("https://other.com/x", BASE)).isEmpty();
        }

        @Test
        void absolute_link_takes_base_scheme() {
            assertThat(keyOf(UrlUtils.normalize("http://github.com/features/b", BASE)))
                    .isEqualTo("https://github.com/features/b");
        }

        @Test
        void root_relative_resolves_against_base_host() {
            assertThat(keyOf(UrlUtils.normalize("/features/a/?q=1#x", BASE)))
                    .isEqualTo("https://github.com/features/a");
        }

        @Test
        void protocol_relative_uses_base_scheme() {
            assertThat(keyOf(UrlUtils.normalize("//github.com/features/c", BASE)))
                    .isEqualTo("https://github.com/features/c");
            assertThat(UrlUtils.normalize("//cdn.other.com/x", BASE)).isEmpty();
        }

        @Test
        void bare_relative_resolves_against_page() {
            assertThat(keyOf(UrlUtils.normalize("sub/page2", BASE)))
                    .isEqualTo("https://github.com/features/sub/page2");
            assertThat(keyOf(UrlUtils.normalize("../about", BASE)))
                    .isEqualTo("https://github.com/about");
        }

        @Test
        void relative_from_root_page() {
            NormalizedUrl root = new NormalizedUrl("https", "github.com", "");
            assertThat(keyOf(UrlUtils.normalize("docs", root))).isEqualTo("https://github.com/docs");
        }

        @Test
        void climbing_above_root_is_discarded() {
            assertThat(UrlUtils.normalize("/../../etc/passwd", BASE)).isEmpty();
        }

        @Test
        void collapses_repeated_slashes_and_dot_segments() {
            assertThat(keyOf(UrlUtils.normalize("/features//./a///", BASE)))
                    .isEqualTo("https://github.com/features/a");
        }

        @ParameterizedTest
        @ValueSource(strings = {"/features/a/", "https://GITHUB.com/features/b?x=1", "sub/./c/", "//github.com//d", "../e#f"})
        void normalization_is_idempotent(String href) {
            NormalizedUrl once = UrlUtils.normalize(href, BASE).orElseThrow();
            NormalizedUrl twice = UrlUtils.normalize(once.key(), BASE).orElseThrow();
            assertThat(twice).isEqualTo(once);
            assertThat(UrlUtils.parseAbsolute(once.key())).contains(once);
        }
    }

    @Nested
    @DisplayName("디렉터리 형태 페이지")
    class DirectoryPages {

        private final NormalizedUrl docs = new NormalizedUrl("https", "example.com", "/docs");

        @Test
        void bare_relative_resolves_below_directory_page() {
            assertThat(keyOf(UrlUtils.normalize("intro", docs, true))).isEqualTo("https://example.com/docs/intro");
            assertThat(keyOf(UrlUtils.normalize("./guide/", docs, true))).isEqualTo("https://example.com/docs/guide");
            assertThat(keyOf(UrlUtils.normalize("../blog", docs, true))).isEqualTo("https://example.com/blog");
        }

        @Test
        void same_href_on_file_style_page_replaces_last_segment() {
            assertThat(keyOf(UrlUtils.normalize("intro", docs, false))).isEqualTo("https://example.com/intro");
            assertThat(keyOf(UrlUtils.normalize("intro", docs))).isEqualTo("https://example.com/intro");
        }

        @Test
        void root_relative_and_absolute_ignore_directory_flag() {
            assertThat(keyOf(UrlUtils.normalize("/a", docs, true))).isEqualTo("https://example.com/a");
            assertThat(keyOf(UrlUtils.normalize("https://example.com/b/", docs, true))).isEqualTo("https://example.com/b");
        }

        @Test
        void directory_form_looks_at_path_only() {
            assertThat(UrlUtils.isDirectoryForm("https://example.com/docs/")).isTrue();
            assertThat(UrlUtils.isDirectoryForm("guide/?page=2#top")).isTrue();
            assertThat(UrlUtils.isDirectoryForm("https://example.com/docs")).isFalse();
            assertThat(UrlUtils.isDirectoryForm("intro#a/")).isFalse();
            assertThat(UrlUtils.isDirectoryForm(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("퍼센트 인코딩")
    class PercentEncoding {

        @Test
        void encoded_tilde_and_plain_tilde_share_one_key() {
            String encoded = UrlUtils.parseAbsolute("https://example.com/docs/%7Euser").orElseThrow().key();
            String lower = UrlUtils.parseAbsolute("https://example.com/docs/%7euser").orElseThrow().key();
            String plain = UrlUtils.parseAbsolute("https://example.com/docs/~user").orElseThrow().key();

            assertThat(encoded).isEqualTo(plain).isEqualTo(lower).isEqualTo("https://example.com/docs/~user");
        }

        @Test
        void reserved_escapes_are_kept_in_upper_case() {
            assertThat(UrlUtils.parseAbsolute("https://example.com/a%2fb").orElseThrow().path()).isEqualTo("/a%2Fb");
            assertThat(UrlUtils.parseAbsolute("https://example.com/a%20b").orElseThrow().path()).isEqualTo("/a%20b");
        }

        @Test
        void decodes_only_unreserved_characters() {
            assertThat(UrlUtils.decodeUnreserved("%41%2f%2D%5f")).isEqualTo("A%2F-_");
            assertThat(UrlUtils.decodeUnreserved("100%")).isEqualTo("100%");
            assertThat(UrlUtils.decodeUnreserved("%zz")).isEqualTo("%zz");
        }

        @Test
        void relative_href_with_encoded_unreserved_matches_plain_link() {
            NormalizedUrl page = new NormalizedUrl("https", "example.com", "/docs");
            assertThat(UrlUtils.normalize("%7Euser", page, true))
                    .isEqualTo(UrlUtils.normalize("~user", page, true));
        }
    }

    @Test
    void normalizePath_handles_edges() {
        assertThat(UrlUtils.normalizePath(null)).isEmpty();
        assertThat(UrlUtils.normalizePath("/")).isEmpty();
        assertThat(UrlUtils.normalizePath("/a/b/../c")).isEqualTo("/a/c");
        assertThat(UrlUtils.normalizePath("/..")).isNull();
    }
}
