package com.axlabs.neo.governance;

import java.util.Collections;
import java.util.List;

/**
 * Utility for paging through proposals.
 */
public class Paginator {

    private Paginator() {
    }

    /**
     * Calculates the start and end indices of a page in the list of {@code n} items.
     *
     * @param n            The total number of available items.
     * @param page         The desired page.
     * @param itemsPerPage The desired number of items per page.
     * @return The start and end index of items on the desired page, plus the total number of pages available given
     * that there are {@code n} items.
     */
    static int[] calcPagination(int n, int page, int itemsPerPage) {
        if (page < 0) {
            throw new IllegalArgumentException("[Paginator.calcPagination] Page number was negative");
        }
        if (itemsPerPage <= 0) {
            throw new IllegalArgumentException("[Paginator.calcPagination] Items per page was negative or zero");
        }
        int pages;
        if (n < itemsPerPage) {
            pages = 1;
        } else if (n % itemsPerPage == 0) {
            pages = n / itemsPerPage;
        } else {
            pages = (n / itemsPerPage) + 1;
        }
        if (page >= pages) throw new IllegalArgumentException("[Paginator.calcPagination] Page out of bounds");
        int startAt = itemsPerPage * page;
        int endAt = startAt + itemsPerPage;
        if (startAt + itemsPerPage > n) {
            endAt = n;
        }
        return new int[]{startAt, endAt, pages};
    }

    /**
     * A page in a set of items.
     * <p>
     * Instead of just returning the items of a page, this gives some context information, i.e., the page number and
     * the total number of pages available.
     */
    public static class Paginated<T> {

        private final int page;
        private final int pages;
        private final List<T> items;

        public Paginated(int page, int pages, List<T> items) {
            this.page = page;
            this.pages = pages;
            this.items = Collections.unmodifiableList(items);
        }

        public int getPage() {
            return page;
        }

        public int getPages() {
            return pages;
        }

        public List<T> getItems() {
            return items;
        }
    }
}
