package com.ktb.wordfilter.dictionary;

import com.ktb.wordfilter.util.AhoCorasickMatcher;
import com.ktb.wordfilter.util.CaseFoldingUtil;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.util.ResourceUtils;

/**
 * 파일 패턴으로 사전 소스를 찾아 새 {@link DictionarySnapshot} 을 빌드한다.
 *
 * <p>개별 파일/줄의 문제는 경고로만 남기고 계속 진행한다 (best-effort).
 * 게시(publish)는 호출자의 책임이다.</p>
 */
@Slf4j
public class DictionaryLoader {

    private static final Pattern URL_SCHEME = Pattern.compile("[A-Za-z][A-Za-z0-9+.\\-]+:");
    private static final String GLOB_META = "*?[{";
    private static final char REPLACEMENT_CHAR = '\uFFFD';

    private final WordNormalizer normalizer;
    private final int placeholder;
    private final int foldedPlaceholder;
    private final boolean requireMatch;
    private final ResourcePatternResolver resolver;
    private final Clock clock;
    private final AtomicLong versionSequence = new AtomicLong();

    public DictionaryLoader(WordNormalizer normalizer, int placeholder, boolean requireMatch) {
        this(normalizer, placeholder, requireMatch, new PathMatchingResourcePatternResolver(), Clock.systemUTC());
    }

    public DictionaryLoader(WordNormalizer normalizer,
                            int placeholder,
                            boolean requireMatch,
                            ResourcePatternResolver resolver,
                            Clock clock) {
        this.normalizer = normalizer;
        this.placeholder = placeholder;
        this.foldedPlaceholder = CaseFoldingUtil.fold(placeholder);
        this.requireMatch = requireMatch;
        this.resolver = resolver;
        this.clock = clock;
    }

    public DictionaryLoadResult load(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new DictionaryLoadException(pattern, "Dictionary pattern must not be blank");
        }

        List<Resource> resources = resolve(pattern.strip());
        if (resources.isEmpty() && requireMatch) {
            throw new DictionaryLoadException(pattern, "No dictionary files matched: " + pattern);
        }

        DictionaryLoadResult.DictionaryLoadResultBuilder result = DictionaryLoadResult.builder().pattern(pattern);
        Set<String> words = new LinkedHashSet<>();
        List<String> sources = new ArrayList<>();
        int linesRead = 0;

        for (Resource resource : resources) {
            String source = describe(resource);
            SourceContents contents = new SourceContents();
            try {
                readWords(resource, source, contents);
            } catch (IOException e) {
                // 파일 하나 실패해도 전체 로드는 계속. 중간까지 읽은 단어는 버린다
                log.warn("Dictionary source unreadable, skipped: {} ({})", source, e.getMessage());
                result.warning(SourceWarning.ofSource(source, "unreadable: " + e.getMessage()));
                continue;
            }
            words.addAll(contents.words);
            result.warnings(contents.warnings);
            linesRead += contents.lines;
            sources.add(source);
        }

        long started = System.nanoTime();
        AhoCorasickMatcher matcher = new AhoCorasickMatcher(words);
        long tookMs = (System.nanoTime() - started) / 1_000_000;

        DictionarySnapshot snapshot = DictionarySnapshot.builder()
                .matcher(matcher)
                .wordCount(matcher.size())
                .builtAt(clock.instant())
                .version(versionSequence.incrementAndGet())
                .sources(sources)
                .build();

        log.info("Dictionary built from '{}': files={}, lines={}, words={}, nodes={}, took={}ms",
                pattern, sources.size(), linesRead, snapshot.getWordCount(), matcher.nodeCount(), tookMs);

        return result.snapshot(snapshot).linesRead(linesRead).build();
    }

    private List<Resource> resolve(String pattern) {
        List<Resource> found = isFileSystemPattern(pattern)
                ? findFiles(pattern)
                : findResources(pattern);

        List<Resource> existing = new ArrayList<>();
        for (Resource resource : found) {
            if (resource.exists()) {
                existing.add(resource);
            }
        }
        existing.sort(Comparator.comparing(DictionaryLoader::describe));
        return existing;
    }

    /**
     * 접두사가 없거나 {@code file:} 로 시작하는 패턴은 파일 시스템 glob 으로 본다.
     */
    static boolean isFileSystemPattern(String pattern) {
        if (pattern.startsWith(ResourceUtils.FILE_URL_PREFIX)) {
            return true;
        }
        if (pattern.startsWith(ResourcePatternResolver.CLASSPATH_ALL_URL_PREFIX)) {
            return false;
        }
        // 한 글자 scheme 은 Windows 드라이브 문자
        return !URL_SCHEME.matcher(pattern).lookingAt();
    }

    private List<Resource> findResources(String pattern) {
        try {
            return Arrays.asList(resolver.getResources(pattern));
        } catch (IOException | IllegalArgumentException e) {
            throw new DictionaryLoadException(pattern, "Invalid dictionary pattern: " + pattern, e);
        }
    }

    /**
     * glob 문법은 {@link FileSystem#getPathMatcher(String)} 를 따른다 ({@code * ? [..] {..} **}).
     * 메타 문자가 없는 앞부분 디렉터리를 기준으로 탐색한다.
     */
    private List<Resource> findFiles(String pattern) {
        String path = pattern.startsWith(ResourceUtils.FILE_URL_PREFIX)
                ? stripFileUrl(pattern)
                : pattern;
        path = path.replace(File.separatorChar, '/');

        int meta = indexOfGlobMeta(path);
        int slash = path.lastIndexOf('/', meta < 0 ? path.length() : meta);
        String base = slash < 0 ? "" : path.substring(0, slash == 0 ? 1 : slash);
        String glob = path.substring(slash + 1);

        FileSystem fileSystem = FileSystems.getDefault();
        Path baseDir;
        PathMatcher matcher;
        try {
            baseDir = base.isEmpty()
                    ? Paths.get("").toAbsolutePath()
                    : Paths.get(base).toAbsolutePath();
            matcher = fileSystem.getPathMatcher("glob:" + glob);
        } catch (IllegalArgumentException e) {
            // PatternSyntaxException, InvalidPathException 모두 여기로
            throw new DictionaryLoadException(pattern, "Invalid dictionary pattern: " + pattern, e);
        }

        if (glob.isEmpty() || !Files.isDirectory(baseDir)) {
            return List.of();
        }

        int depth = glob.contains("/") || glob.contains("**") ? Integer.MAX_VALUE : 1;
        try (Stream<Path> walk = Files.walk(baseDir, depth)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(file -> matcher.matches(baseDir.relativize(file)))
                    .<Resource>map(FileSystemResource::new)
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new DictionaryLoadException(pattern, "Cannot list dictionary directory: " + baseDir, e);
        }
    }

    private static String stripFileUrl(String pattern) {
        String path = pattern.substring(ResourceUtils.FILE_URL_PREFIX.length());
        // file:///abs → /abs
        return path.startsWith("///") ? path.substring(2) : path;
    }

    private static int indexOfGlobMeta(String path) {
        for (int i = 0; i < path.length(); i++) {
            if (GLOB_META.indexOf(path.charAt(i)) >= 0) {
                return i;
            }
        }
        return -1;
    }

    private void readWords(Resource resource, String source, SourceContents contents) throws IOException {
        int lineNumber = 0;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                Optional<String> word = normalizer.normalize(line);
                if (word.isEmpty()) {
                    continue;
                }
                if (word.get().indexOf(REPLACEMENT_CHAR) >= 0) {
                    // 잘못된 UTF-8 바이트는 디코더가 U+FFFD 로 바꿔 놓음
                    log.warn("Dictionary line is not valid UTF-8, skipped: {}:{}", source, lineNumber);
                    contents.warnings.add(SourceWarning.ofLine(source, lineNumber, "malformed UTF-8"));
                    continue;
                }
                if (word.get().indexOf(placeholder) >= 0 || word.get().indexOf(foldedPlaceholder) >= 0) {
                    // 마스킹 문자를 포함한 단어는 마스킹 결과를 다시 매칭시킬 수 있음
                    log.warn("Dictionary word contains mask placeholder, skipped: {}:{}", source, lineNumber);
                    contents.warnings.add(SourceWarning.ofLine(source, lineNumber, "contains mask placeholder"));
                    continue;
                }
                contents.words.add(word.get());
            }
        }
        contents.lines = lineNumber;
    }

    /** 파일 하나를 끝까지 읽은 뒤에만 전체 결과에 합쳐진다. */
    private static final class SourceContents {
        private final Set<String> words = new LinkedHashSet<>();
        private final List<SourceWarning> warnings = new ArrayList<>();
        private int lines;
    }

    private static String describe(Resource resource) {
        try {
            return resource.getURI().toString();
        } catch (IOException e) {
            return resource.getDescription();
        }
    }
}
