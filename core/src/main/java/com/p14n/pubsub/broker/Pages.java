package com.p14n.pubsub.broker;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import com.google.common.io.BaseEncoding;
import com.p14n.pubsub.PubsubException;
import com.p14n.pubsub.data.Page;

/**
 * Cursor pagination over name-ordered listings. A page token is the URL-safe
 * base64 form of the last name on the previous page.
 */
final class Pages {

    static final int DEFAULT_PAGE_SIZE = 100;
    static final int MAX_PAGE_SIZE = 1000;

    private static final BaseEncoding TOKENS = BaseEncoding.base64Url().omitPadding();

    private Pages() {
    }

    /**
     * @param sorted    Items sorted by {@code key}
     * @param key       The name each item is ordered by
     * @param pageSize  Requested size, non-positive for the default
     * @param pageToken Token from the previous page, empty for the first
     */
    static <T> Page<T> page(List<T> sorted, Function<T, String> key, int pageSize, String pageToken) {
        int size = pageSize <= 0 ? DEFAULT_PAGE_SIZE : Math.min(pageSize, MAX_PAGE_SIZE);
        String after = pageToken == null || pageToken.isEmpty() ? null : decode(pageToken);

        var items = new ArrayList<T>(Math.min(size, sorted.size()));
        boolean more = false;
        for (var item : sorted) {
            if (after != null && key.apply(item).compareTo(after) <= 0) {
                continue;
            }
            if (items.size() == size) {
                more = true;
                break;
            }
            items.add(item);
        }
        String next = more ? encode(key.apply(items.get(items.size() - 1))) : "";
        return new Page<>(items, next);
    }

    static String encode(String name) {
        return TOKENS.encode(name.getBytes(StandardCharsets.UTF_8));
    }

    static String decode(String token) {
        try {
            return new String(TOKENS.decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new PubsubException(PubsubException.ErrorCode.INVALID_ARGUMENT,
                    "Malformed page token: " + token, e);
        }
    }
}
