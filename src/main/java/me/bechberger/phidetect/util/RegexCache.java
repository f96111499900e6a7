package me.bechberger.phidetect.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Thread-safe cache for compiled regular expressions from configuration.
 *
 * Usage:
 * <pre>
 * RegexCache cache = new RegexCache();
 * Pattern p = cache.getPattern("mrn\\s*:?\\s*$", Pattern.CASE_INSENSITIVE);
 * Pattern q = cache.getPatternOrLiteral("Dr. (", 0);   // invalid regex, matched literally
 * </pre>
 */
public class RegexCache {

    private static final Logger logger = LoggerFactory.getLogger(RegexCache.class);

    private final ConcurrentHashMap<CacheKey, Pattern> cache = new ConcurrentHashMap<>();

    /**
     * Cache key combining pattern string and flags.
     */
    private static class CacheKey {
        private final String pattern;
        private final int flags;
        private final boolean literalFallback;

        CacheKey(String pattern, int flags, boolean literalFallback) {
            this.pattern = pattern;
            this.flags = flags;
            this.literalFallback = literalFallback;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            CacheKey cacheKey = (CacheKey) o;
            return flags == cacheKey.flags && literalFallback == cacheKey.literalFallback
                && pattern.equals(cacheKey.pattern);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * pattern.hashCode() + flags) + (literalFallback ? 1 : 0);
        }
    }

    public Pattern getPattern(String regex) {
        return getPattern(regex, 0);
    }

    /**
     * Get or compile a pattern.
     *
     * @throws PatternSyntaxException if the expression is invalid
     */
    public Pattern getPattern(String regex, int flags) {
        return cache.computeIfAbsent(new CacheKey(regex, flags, false), k -> Pattern.compile(regex, flags));
    }

    /**
     * Get or compile a pattern; an invalid expression is matched as literal text instead.
     */
    public Pattern getPatternOrLiteral(String regex, int flags) {
        return cache.computeIfAbsent(new CacheKey(regex, flags, true), k -> {
            try {
                return Pattern.compile(regex, flags);
            } catch (PatternSyntaxException e) {
                logger.debug("Invalid regex '{}', matching it literally: {}", regex, e.getDescription());
                return Pattern.compile(Pattern.quote(regex), flags);
            }
        });
    }

    public int size() {
        return cache.size();
    }
}
