package com.github.dimitryivaniuta.linkorganizer.audit;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drops credential-bearing headers before a header map is persisted.
 *
 * <p>{@code null} in gives {@code null} out, so "no headers captured" stays distinguishable
 * from "every header was sensitive" (an empty map).
 */
public final class HeaderSanitizer {

    private final Set<String> sensitive;

    public HeaderSanitizer(Collection<String> sensitiveHeaderNames) {
        this.sensitive = sensitiveHeaderNames.stream()
                .filter(n -> n != null && !n.isBlank())
                .map(n -> n.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public Map<String, String> sanitize(Map<String, String> headers) {
        if (headers == null) return null;

        Map<String, String> out = new LinkedHashMap<>();
        headers.forEach((name, value) -> {
            if (name != null && !isSensitive(name)) {
                out.put(name, value);
            }
        });
        return out;
    }

    public boolean isSensitive(String headerName) {
        return sensitive.contains(headerName.toLowerCase(Locale.ROOT));
    }
}
