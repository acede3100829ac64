package io.github.drompincen.knowpipe.runtime.cache;

import io.github.drompincen.knowpipe.protocol.api.CacheEntry;
import io.github.drompincen.knowpipe.protocol.api.CacheKey;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Selector for {@link CacheStore#invalidate}: explicit keys, a dimension filter, a glob over the
 * stored query, or an arbitrary predicate.
 */
public interface CacheInvalidation {

    boolean matches(CacheEntry entry);

    /** Exact key ids when the selector names them, letting the store skip the scan. */
    default Optional<Set<String>> keyIds() {
        return Optional.empty();
    }

    /** Dimension filter when the selector is one, letting the store use its slice indexes. */
    default Optional<CacheFilter> filter() {
        return Optional.empty();
    }

    static CacheInvalidation keys(Collection<CacheKey> keys) {
        Set<String> ids = new LinkedHashSet<>();
        for (CacheKey key : keys) ids.add(key.id());
        return new ByKeys(Set.copyOf(ids));
    }

    static CacheInvalidation keys(CacheKey... keys) {
        return keys(Arrays.asList(keys));
    }

    static CacheInvalidation matching(CacheFilter filter) {
        return new ByFilter(filter);
    }

    /** Glob over the stored query: {@code *} any run of characters, {@code ?} one character. Case-insensitive. */
    static CacheInvalidation queryGlob(String glob) {
        return new ByGlob(glob, compileGlob(glob));
    }

    static CacheInvalidation where(Predicate<CacheEntry> predicate) {
        return new ByPredicate(predicate);
    }

    static Pattern compileGlob(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) regex.append(Pattern.quote(literal.toString()));
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    record ByKeys(Set<String> ids) implements CacheInvalidation {
        @Override
        public boolean matches(CacheEntry entry) {
            return ids.contains(entry.key().id());
        }

        @Override
        public Optional<Set<String>> keyIds() {
            return Optional.of(ids);
        }
    }

    record ByFilter(CacheFilter value) implements CacheInvalidation {
        public ByFilter {
            Objects.requireNonNull(value, "filter");
        }

        @Override
        public boolean matches(CacheEntry entry) {
            return value.matches(entry);
        }

        @Override
        public Optional<CacheFilter> filter() {
            return Optional.of(value);
        }
    }

    record ByGlob(String glob, Pattern pattern) implements CacheInvalidation {
        @Override
        public boolean matches(CacheEntry entry) {
            return entry.query() != null && pattern.matcher(entry.query()).matches();
        }
    }

    record ByPredicate(Predicate<CacheEntry> predicate) implements CacheInvalidation {
        public ByPredicate {
            Objects.requireNonNull(predicate, "predicate");
        }

        @Override
        public boolean matches(CacheEntry entry) {
            return predicate.test(entry);
        }
    }
}
