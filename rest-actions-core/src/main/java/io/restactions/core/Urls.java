package io.restactions.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Path and query helpers. Query parameter keys are emitted in lexicographic order.
 */
public final class Urls {
    private Urls() {}

    /**
     * Joins path segments with single slashes, trimming slashes at each boundary.
     * Empty segments are skipped.
     */
    public static String join(String... segments) {
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            if (segment == null) continue;
            String trimmed = trim(segment);
            if (trimmed.isEmpty()) continue;
            if (sb.length() > 0) sb.append('/');
            sb.append(trimmed);
        }
        return sb.toString();
    }

    /**
     * Encodes a resource id for use as a single path segment.
     */
    public static String segment(String id) {
        Objects.requireNonNull(id, "id");
        return URLEncoder.encode(id, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public static URI resolve(URI base, String path) {
        Objects.requireNonNull(base, "base");
        String root = base.toString();
        while (root.endsWith("/")) {
            root = root.substring(0, root.length() - 1);
        }
        String rel = path == null ? "" : trim(path);
        return URI.create(rel.isEmpty() ? root : root + "/" + rel);
    }

    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) return base;

        TreeMap<String, String> sorted = new TreeMap<>(params);
        StringBuilder sb = new StringBuilder(base.toString());
        sb.append(base.getQuery() == null ? "?" : "&");

        boolean first = true;
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            if (!first) sb.append("&");
            first = false;
            sb.append(encode(e.getKey())).append("=").append(encode(e.getValue()));
        }
        return URI.create(sb.toString());
    }

    private static String trim(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '/') start++;
        while (end > start && s.charAt(end - 1) == '/') end--;
        return s.substring(start, end);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
