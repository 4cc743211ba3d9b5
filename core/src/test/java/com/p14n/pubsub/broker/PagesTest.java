package com.p14n.pubsub.broker;

import java.util.ArrayList;
import java.util.List;

import com.p14n.pubsub.PubsubException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PagesTest {

    private static List<String> names(int count) {
        var names = new ArrayList<String>();
        for (int i = 0; i < count; i++) {
            names.add(String.format("projects/p/topics/t%04d", i));
        }
        return names;
    }

    @Test
    void nonPositivePageSizeUsesDefault() {
        var page = Pages.page(names(150), n -> n, 0, "");

        assertEquals(Pages.DEFAULT_PAGE_SIZE, page.items().size());
        assertTrue(page.hasNextPage());
    }

    @Test
    void pageSizeIsCapped() {
        var page = Pages.page(names(1500), n -> n, 5000, null);

        assertEquals(Pages.MAX_PAGE_SIZE, page.items().size());
    }

    @Test
    void tokenResumesAfterLastName() {
        var all = names(5);
        var first = Pages.page(all, n -> n, 2, "");
        var second = Pages.page(all, n -> n, 2, first.nextPageToken());
        var third = Pages.page(all, n -> n, 2, second.nextPageToken());

        assertEquals(all.subList(0, 2), first.items());
        assertEquals(all.subList(2, 4), second.items());
        assertEquals(all.subList(4, 5), third.items());
        assertEquals("", third.nextPageToken());
    }

    @Test
    void exactlyFullPageHasNoNextToken() {
        var page = Pages.page(names(3), n -> n, 3, "");

        assertFalse(page.hasNextPage());
    }

    @Test
    void tokenIsUrlSafe() {
        var token = Pages.encode("projects/p/topics/a?b>c");

        assertFalse(token.contains("/"));
        assertFalse(token.contains("+"));
        assertEquals("projects/p/topics/a?b>c", Pages.decode(token));
    }

    @Test
    void malformedTokenIsInvalidArgument() {
        var e = assertThrows(PubsubException.class, () -> Pages.page(names(3), n -> n, 1, "%%%"));
        assertEquals(PubsubException.ErrorCode.INVALID_ARGUMENT, e.code());
    }
}
