package com.yerin.pipeline.domain;

import com.yerin.pipeline.global.exception.ResourceKeyException;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Derives the canonical resource key used to deduplicate pipeline work.
 * <p>
 * Keys are pure functions of their input: {@code yt:<videoId>}, {@code url:<16 chars>} or
 * {@code cid:<contentId>}. No network or database access happens here.
 */
@Component
public class ResourceKeyCodec {

    static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content",
            "fbclid", "gclid", "mc_cid", "mc_eid", "_ga", "_gid");

    private static final int HASH_BYTES = 12; // 12 bytes -> 16 base64url chars

    public String derive(ResourceKind kind, String identifierOrUrl) {
        if (identifierOrUrl == null || identifierOrUrl.isBlank()) {
            throw new ResourceKeyException("리소스 식별자가 비어 있습니다.");
        }
        String identifier = identifierOrUrl.trim();
        return switch (kind == null ? ResourceKind.CONTENT : kind) {
            case YOUTUBE -> ResourceKind.YOUTUBE.prefix() + ":" + identifier;
            case URL -> ResourceKind.URL.prefix() + ":" + hash16(normalizeUrl(identifier));
            case CONTENT -> ResourceKind.CONTENT.prefix() + ":" + identifier;
        };
    }

    /**
     * Lowercases scheme and host, upgrades http to https, drops default ports, fragment,
     * user info, trailing slash (except root) and tracking parameters, and sorts the rest.
     */
    public String normalizeUrl(String url) {
        UriComponents uri;
        int port;
        try {
            // accepts underscores in hosts and unescaped spaces, unlike java.net.URI
            uri = UriComponentsBuilder.fromUriString(url.trim()).build();
            port = uri.getPort();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ResourceKeyException("URL 형식이 올바르지 않습니다: " + e.getMessage(), e);
        }
        if (uri.getScheme() == null || uri.getHost() == null || uri.getHost().isBlank()) {
            throw new ResourceKeyException("절대 URL 이 필요합니다: " + url);
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (scheme.equals("http")) scheme = "https";

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (port == 80 || port == 443) port = -1;

        String path = uri.getPath() == null ? "" : uri.getPath();
        if (!path.equals("/") && path.endsWith("/")) {
            path = stripTrailingSlashes(path);
        }

        StringBuilder sb = new StringBuilder()
                .append(scheme).append("://").append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);

        String query = canonicalQuery(uri.getQuery());
        if (!query.isEmpty()) sb.append('?').append(query);
        return sb.toString();
    }

    private static String canonicalQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return "";

        Map<String, List<String>> params = new LinkedHashMap<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            if (TRACKING_PARAMS.contains(key)) continue;
            params.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }

        StringJoiner joiner = new StringJoiner("&");
        new TreeMap<>(params).forEach((key, values) -> {
            for (String value : values) {
                joiner.add(encode(key) + "=" + encode(value));
            }
        });
        return joiner.toString();
    }

    private static String stripTrailingSlashes(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') end--;
        return path.substring(0, end);
    }

    private static String hash16(String normalized) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(normalized.getBytes(StandardCharsets.UTF_8));
            byte[] prefix = new byte[HASH_BYTES];
            System.arraycopy(digest, 0, prefix, 0, HASH_BYTES);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(prefix);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // malformed percent escapes are kept verbatim
            return s;
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
