package com.customdim.service.core.extraction;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Base for sources that match a capture-group regex against a single request attribute. */
public abstract class RegexExtractionSource implements ExtractionSource {

    private final Cache<PatternKey, Pattern> compiled =
            Caffeine.newBuilder().maximumSize(1_000).build();

    @Override
    public PatternKind patternKind() {
        return PatternKind.CAPTURE_GROUP;
    }

    /** The attribute the pattern is matched against, or {@code null} when the request lacks it. */
    protected abstract String subject(TrackingRequest request);

    @Override
    public Optional<String> extract(TrackingRequest request, String pattern, boolean caseSensitive) {
        String subject = subject(request);
        if (subject == null || subject.isEmpty()) {
            return Optional.empty();
        }
        Pattern p = compiled.get(new PatternKey(pattern, caseSensitive), RegexExtractionSource::compile);
        Matcher m = p.matcher(subject);
        if (!m.find() || m.groupCount() < 1) {
            return Optional.empty();
        }
        return Optional.ofNullable(m.group(1));
    }

    private static Pattern compile(PatternKey key) {
        int flags = key.caseSensitive() ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        return Pattern.compile(key.pattern(), flags);
    }

    private record PatternKey(String pattern, boolean caseSensitive) {}
}
