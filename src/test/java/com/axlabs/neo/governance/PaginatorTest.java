package com.axlabs.neo.governance;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PaginatorTest {

    @Test
    public void succeed_calculating_pages() {
        assertThat(Paginator.calcPagination(10, 0, 3), is(new int[]{0, 3, 4}));
        assertThat(Paginator.calcPagination(10, 3, 3), is(new int[]{9, 10, 4}));
        assertThat(Paginator.calcPagination(9, 2, 3), is(new int[]{6, 9, 3}));
        assertThat(Paginator.calcPagination(2, 0, 5), is(new int[]{0, 2, 1}));
        assertThat(Paginator.calcPagination(0, 0, 5), is(new int[]{0, 0, 1}));
    }

    @Test
    public void fail_calculating_invalid_pages() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Paginator.calcPagination(10, -1, 3));
        assertTrue(e.getMessage().endsWith("Page number was negative"));
        e = assertThrows(IllegalArgumentException.class, () -> Paginator.calcPagination(10, 0, 0));
        assertTrue(e.getMessage().endsWith("Items per page was negative or zero"));
        e = assertThrows(IllegalArgumentException.class, () -> Paginator.calcPagination(10, 4, 3));
        assertTrue(e.getMessage().endsWith("Page out of bounds"));
    }
}
