package com.ktb.wordfilter.dictionary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.regex.PatternSyntaxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

class DictionaryLoaderTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path dir;

    private final WordNormalizer normalizer = new WordNormalizer("#");

    private DictionaryLoader loader(boolean requireMatch) {
        return new DictionaryLoader(normalizer, '*', requireMatch,
                new PathMatchingResourcePatternResolver(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private String pattern(String glob) {
        return "file:" + dir.toAbsolutePath().toString().replace('\\', '/') + "/" + glob;
    }

    @Test
    void load_mergesFilesAndDeduplicates() throws IOException {
        Files.write(dir.resolve("a.txt"), List.of("# comment", "Bad", "", "evil"), StandardCharsets.UTF_8);
        Files.write(dir.resolve("b.txt"), List.of("bad", "ugly"), StandardCharsets.UTF_8);
        Files.write(dir.resolve("ignored.csv"), List.of("csv"), StandardCharsets.UTF_8);

        DictionaryLoadResult result = loader(true).load(pattern("*.txt"));
        DictionarySnapshot snapshot = result.getSnapshot();

        assertThat(snapshot.getWordCount()).isEqualTo(3);
        assertThat(snapshot.getSources()).hasSize(2);
        assertThat(snapshot.getSources().get(0)).endsWith("a.txt");
        assertThat(snapshot.getBuiltAt()).isEqualTo(NOW);
        assertThat(snapshot.getVersion()).isEqualTo(1L);
        assertThat(result.getLinesRead()).isEqualTo(6);
        assertThat(result.hasWarnings()).isFalse();

        assertThat(snapshot.getMatcher().contains("so UGLY")).isTrue();
        assertThat(snapshot.getMatcher().contains("csv")).isFalse();
        // 주석/빈 줄은 매칭 대상이 아님
        assertThat(snapshot.getMatcher().contains("# comment")).isFalse();
    }

    @Test
    void load_versionIncreasesOnEveryBuild() throws IOException {
        Files.write(dir.resolve("a.txt"), List.of("bad"), StandardCharsets.UTF_8);
        DictionaryLoader loader = loader(true);

        assertThat(loader.load(pattern("*.txt")).getSnapshot().getVersion()).isEqualTo(1L);
        assertThat(loader.load(pattern("*.txt")).getSnapshot().getVersion()).isEqualTo(2L);
    }

    @Test
    void load_noMatchingFiles_requiredFails() {
        assertThatThrownBy(() -> loader(true).load(pattern("*.txt")))
                .isInstanceOf(DictionaryLoadException.class)
                .hasMessageContaining("No dictionary files matched");
    }

    @Test
    void load_noMatchingFiles_optionalYieldsEmptyDictionary() {
        DictionarySnapshot snapshot = loader(false).load(pattern("*.txt")).getSnapshot();

        assertThat(snapshot.isEmpty()).isTrue();
        assertThat(snapshot.getMatcher().contains("bad")).isFalse();
    }

    @Test
    void load_blankPatternFails() {
        assertThatThrownBy(() -> loader(false).load("  "))
                .isInstanceOf(DictionaryLoadException.class);
        assertThatThrownBy(() -> loader(false).load(null))
                .isInstanceOf(DictionaryLoadException.class);
    }

    @Test
    void load_wordContainingPlaceholderIsSkippedWithWarning() throws IOException {
        Files.write(dir.resolve("a.txt"), List.of("bad", "f*ck", "evil"), StandardCharsets.UTF_8);

        DictionaryLoadResult result = loader(true).load(pattern("*.txt"));

        assertThat(result.getSnapshot().getWordCount()).isEqualTo(2);
        assertThat(result.getWarnings()).singleElement().satisfies(warning -> {
            assertThat(warning.getSource()).endsWith("a.txt");
            assertThat(warning.getLineNumber()).isEqualTo(2);
        });
    }

    @Test
    void load_unreadableSourceIsSkipped() throws IOException {
        Resource broken = mock(Resource.class);
        when(broken.exists()).thenReturn(true);
        when(broken.getURI()).thenReturn(URI.create("file:/dict/broken.txt"));
        when(broken.getInputStream()).thenThrow(new IOException("permission denied"));
        Resource good = new ByteArrayResource("bad\nevil\n".getBytes(StandardCharsets.UTF_8), "in-memory");

        ResourcePatternResolver resolver = mock(ResourcePatternResolver.class);
        when(resolver.getResources(anyString())).thenReturn(new Resource[]{broken, good});

        DictionaryLoader loader = new DictionaryLoader(normalizer, '*', true, resolver, Clock.systemUTC());
        DictionaryLoadResult result = loader.load("classpath:dict/*.txt");

        assertThat(result.getSnapshot().getWordCount()).isEqualTo(2);
        assertThat(result.getSnapshot().getSources()).hasSize(1);
        assertThat(result.getWarnings()).singleElement().satisfies(warning -> {
            assertThat(warning.getSource()).isEqualTo("file:/dict/broken.txt");
            assertThat(warning.getLineNumber()).isZero();
            assertThat(warning.getReason()).contains("permission denied");
        });
    }

    @Test
    void load_resolutionErrorFails() throws IOException {
        ResourcePatternResolver resolver = mock(ResourcePatternResolver.class);
        when(resolver.getResources(anyString())).thenThrow(new IOException("bad root"));

        DictionaryLoader loader = new DictionaryLoader(normalizer, '*', false, resolver, Clock.systemUTC());

        assertThatThrownBy(() -> loader.load("classpath:dict/*.txt"))
                .isInstanceOf(DictionaryLoadException.class)
                .hasMessageContaining("Invalid dictionary pattern")
                .hasCauseInstanceOf(IOException.class)
                .extracting(e -> ((DictionaryLoadException) e).getPattern())
                .isEqualTo("classpath:dict/*.txt");
    }

    @Test
    void load_classpathPattern() {
        DictionaryLoadResult result = loader(true).load("classpath:dictionary/*.txt");

        assertThat(result.getSnapshot().getWordCount()).isEqualTo(6);
        assertThat(result.getSnapshot().getMatcher().contains("a BAD WORD here")).isTrue();
        assertThat(result.getSnapshot().getMatcher().contains("바보야")).isTrue();
    }

    @Test
    void load_partiallyReadSourceContributesNothing() throws IOException {
        Resource broken = mock(Resource.class);
        when(broken.exists()).thenReturn(true);
        when(broken.getURI()).thenReturn(URI.create("file:/dict/broken.txt"));
        when(broken.getInputStream()).thenReturn(failingAfter("partial\nleftover\n"));
        Resource good = new ByteArrayResource("bad\n".getBytes(StandardCharsets.UTF_8), "in-memory");

        ResourcePatternResolver resolver = mock(ResourcePatternResolver.class);
        when(resolver.getResources(anyString())).thenReturn(new Resource[]{broken, good});

        DictionaryLoader loader = new DictionaryLoader(normalizer, '*', true, resolver, Clock.systemUTC());
        DictionaryLoadResult result = loader.load("classpath:dict/*.txt");

        assertThat(result.getSnapshot().getWordCount()).isEqualTo(1);
        assertThat(result.getSnapshot().getMatcher().contains("partial")).isFalse();
        assertThat(result.getSnapshot().getMatcher().contains("leftover")).isFalse();
        assertThat(result.getLinesRead()).isEqualTo(1);
        assertThat(result.getWarnings()).singleElement().satisfies(warning -> {
            assertThat(warning.getSource()).isEqualTo("file:/dict/broken.txt");
            assertThat(warning.getReason()).contains("connection reset");
        });
    }

    private static InputStream failingAfter(String content) {
        return new FilterInputStream(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8))) {
            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                int n = super.read(b, off, len);
                if (n < 0) {
                    throw new IOException("connection reset");
                }
                return n;
            }
        };
    }

    @Test
    void load_malformedUtf8LineIsSkippedWithWarning() throws IOException {
        Files.write(dir.resolve("a.txt"), new byte[]{'b', (byte) 0xFF, 'd', '\n', 'o', 'k', '\n'});

        DictionaryLoadResult result = loader(true).load(pattern("*.txt"));

        assertThat(result.getSnapshot().getWordCount()).isEqualTo(1);
        assertThat(result.getSnapshot().getMatcher().contains("ok")).isTrue();
        assertThat(result.getSnapshot().getMatcher().contains("b\uFFFDd")).isFalse();
        assertThat(result.getWarnings()).singleElement().satisfies(warning -> {
            assertThat(warning.getLineNumber()).isEqualTo(1);
            assertThat(warning.getReason()).contains("UTF-8");
        });
    }

    @Test
    void load_characterClassGlob() throws IOException {
        Files.write(dir.resolve("dict1.txt"), List.of("bad"), StandardCharsets.UTF_8);
        Files.write(dir.resolve("dictx.txt"), List.of("evil"), StandardCharsets.UTF_8);

        DictionarySnapshot snapshot = loader(true).load(pattern("dict[0-9].txt")).getSnapshot();

        assertThat(snapshot.getSources()).singleElement().asString().endsWith("dict1.txt");
        assertThat(snapshot.getMatcher().contains("bad")).isTrue();
        assertThat(snapshot.getMatcher().contains("evil")).isFalse();
    }

    @Test
    void load_braceAndRecursiveGlobs() throws IOException {
        Files.createDirectories(dir.resolve("sub"));
        Files.write(dir.resolve("sub/a.txt"), List.of("bad"), StandardCharsets.UTF_8);
        Files.write(dir.resolve("sub/b.dic"), List.of("evil"), StandardCharsets.UTF_8);
        Files.write(dir.resolve("top.txt"), List.of("ugly"), StandardCharsets.UTF_8);

        DictionarySnapshot braces = loader(true).load(pattern("sub/*.{txt,dic}")).getSnapshot();
        DictionarySnapshot nested = loader(true).load(pattern("**/*.txt")).getSnapshot();

        assertThat(braces.getWordCount()).isEqualTo(2);
        // ** 는 한 단계 이상의 하위 디렉터리만 매칭
        assertThat(nested.getSources()).singleElement().asString().endsWith("a.txt");
    }

    @Test
    void load_malformedGlobFails() {
        assertThatThrownBy(() -> loader(false).load(pattern("dict[.txt")))
                .isInstanceOf(DictionaryLoadException.class)
                .hasMessageContaining("Invalid dictionary pattern")
                .hasCauseInstanceOf(PatternSyntaxException.class);
    }

    @Test
    void load_missingDirectoryMatchesNothing() {
        assertThatThrownBy(() -> loader(true).load(pattern("nowhere/*.txt")))
                .isInstanceOf(DictionaryLoadException.class)
                .hasMessageContaining("No dictionary files matched");
    }

    @Test
    void isFileSystemPattern_byPrefix() {
        assertThat(DictionaryLoader.isFileSystemPattern("*.txt")).isTrue();
        assertThat(DictionaryLoader.isFileSystemPattern("dict/[ab].txt")).isTrue();
        assertThat(DictionaryLoader.isFileSystemPattern("file:/var/dict/*.txt")).isTrue();
        assertThat(DictionaryLoader.isFileSystemPattern("C:/dict/*.txt")).isTrue();
        assertThat(DictionaryLoader.isFileSystemPattern("classpath:dict/*.txt")).isFalse();
        assertThat(DictionaryLoader.isFileSystemPattern("classpath*:dict/*.txt")).isFalse();
        assertThat(DictionaryLoader.isFileSystemPattern("https://example.com/dict.txt")).isFalse();
    }
}
