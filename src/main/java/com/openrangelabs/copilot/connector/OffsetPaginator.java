package com.openrangelabs.copilot.connector;

import com.openrangelabs.copilot.model.ConnectorResult;
import com.openrangelabs.copilot.model.ErrorInfo;
import com.openrangelabs.copilot.model.PaginationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Offset/limit pagination shared by the connectors.
 *
 * <p>Pages are requested one after another starting at offset 0, each offset
 * advancing by the page size. The walk ends at the first page shorter than the
 * page size, or once {@link PaginationSettings#getMaxRecords()} records are
 * accumulated; in that case the result is truncated to the ceiling. The first
 * failed page ends the walk and its error is returned; records gathered so far
 * are discarded.
 */
public class OffsetPaginator {

    private static final Logger logger = LoggerFactory.getLogger(OffsetPaginator.class);

    private final PaginationSettings settings;

    public OffsetPaginator(PaginationSettings settings) {
        this.settings = settings;
    }

    /**
     * Fetches one page.
     */
    @FunctionalInterface
    public interface PageFetcher<T> {
        Mono<ConnectorResult<List<T>>> fetch(int offset, int pageSize);
    }

    public <T> Mono<ConnectorResult<List<T>>> fetchAll(String description, PageFetcher<T> fetcher) {
        int pageSize = settings.getPageSize();
        int maxRecords = settings.getMaxRecords();
        return Mono.defer(() -> {
            List<T> accumulated = new ArrayList<>();
            AtomicReference<ErrorInfo> failure = new AtomicReference<>();
            AtomicInteger pages = new AtomicInteger();

            // concatMap drains synchronous pages in a loop, so the stack stays flat
            return Flux.range(0, settings.maxPages())
                    .concatMap(page -> fetcher.fetch(page * pageSize, pageSize))
                    .takeUntil(result -> {
                        pages.incrementAndGet();
                        return result.fold(
                                page -> {
                                    accumulated.addAll(page);
                                    return page.size() < pageSize || accumulated.size() >= maxRecords;
                                },
                                error -> {
                                    failure.set(error);
                                    return true;
                                });
                    })
                    .then(Mono.fromSupplier(() -> complete(description, accumulated, failure.get(), pages.get())));
        });
    }

    private <T> ConnectorResult<List<T>> complete(String description, List<T> accumulated,
                                                  ErrorInfo failure, int pages) {
        if (failure != null) {
            logger.warn("Pagination of {} aborted at offset {}: {}",
                    description, (pages - 1) * settings.getPageSize(), failure.getMessage());
            return ConnectorResult.err(failure);
        }
        if (accumulated.size() >= settings.getMaxRecords()) {
            logger.warn("Stopped paginating {} at the {}-record ceiling", description, settings.getMaxRecords());
            return ConnectorResult.ok(freeze(accumulated.subList(0, settings.getMaxRecords())));
        }
        logger.info("Fetched {} records for {} in {} page(s)", accumulated.size(), description, pages);
        return ConnectorResult.ok(freeze(accumulated));
    }

    private static <T> List<T> freeze(List<T> records) {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public PaginationSettings getSettings() {
        return settings;
    }
}
