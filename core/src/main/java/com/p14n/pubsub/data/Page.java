package com.p14n.pubsub.data;

import java.util.List;

/**
 * One page of a listing. An empty {@code nextPageToken} means there are no
 * further pages.
 */
public record Page<T>(List<T> items, String nextPageToken) {

    public Page {
        items = List.copyOf(items);
        nextPageToken = nextPageToken == null ? "" : nextPageToken;
    }

    public boolean hasNextPage() {
        return !nextPageToken.isEmpty();
    }
}
