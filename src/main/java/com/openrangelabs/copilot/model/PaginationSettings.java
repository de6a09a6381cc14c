package com.openrangelabs.copilot.model;

/**
 * Page size and record ceiling for bulk fetches.
 *
 * <p>A bulk fetch stops at the first short page or once {@code maxRecords}
 * records have been accumulated, whichever comes first.
 */
public class PaginationSettings {

    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int DEFAULT_MAX_RECORDS = 10_000;

    private final int pageSize;
    private final int maxRecords;

    public PaginationSettings(int pageSize, int maxRecords) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        if (maxRecords <= 0) {
            throw new IllegalArgumentException("maxRecords must be positive: " + maxRecords);
        }
        this.pageSize = pageSize;
        this.maxRecords = maxRecords;
    }

    public static PaginationSettings defaults() {
        return new PaginationSettings(DEFAULT_PAGE_SIZE, DEFAULT_MAX_RECORDS);
    }

    /**
     * Upper bound on the number of page requests one bulk fetch can issue.
     */
    public int maxPages() {
        return (maxRecords + pageSize - 1) / pageSize;
    }

    // Getters
    public int getPageSize() { return pageSize; }
    public int getMaxRecords() { return maxRecords; }

    @Override
    public String toString() {
        return "PaginationSettings{" +
                "pageSize=" + pageSize +
                ", maxRecords=" + maxRecords +
                '}';
    }
}
