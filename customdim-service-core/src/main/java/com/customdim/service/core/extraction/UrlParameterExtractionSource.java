package com.customdim.service.core.extraction;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Reads the value of a named query parameter from the page URL. */
@Component
@Order(20)
public class UrlParameterExtractionSource implements ExtractionSource {

    @Override
    public String id() {
        return "urlparam";
    }

    @Override
    public String displayName() {
        return "Page URL Parameter";
    }

    @Override
    public PatternKind patternKind() {
        return PatternKind.PARAMETER_NAME;
    }

    @Override
    public Optional<String> extract(TrackingRequest request, String parameterName, boolean caseSensitive) {
        String url = request.url();
        if (url == null) {
            return Optional.empty();
        }
        int q = url.indexOf('?');
        if (q < 0) {
            return Optional.empty();
        }
        String query = url.substring(q + 1);
        int hash = query.indexOf('#');
        if (hash >= 0) {
            query = query.substring(0, hash);
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            boolean matches = caseSensitive ? key.equals(parameterName) : key.equalsIgnoreCase(parameterName);
            if (matches) {
                return eq < 0 ? Optional.empty() : Optional.of(decode(pair.substring(eq + 1)));
            }
        }
        return Optional.empty();
    }

    private static String decode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // malformed percent escape, keep the raw text
            return raw;
        }
    }
}
