package com.whereq.dispatch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.dispatch.decode.FieldCoercion;
import com.whereq.dispatch.decode.ResponseShape;
import com.whereq.dispatch.decode.StatusDecoder;
import com.whereq.dispatch.model.JobPage;
import com.whereq.dispatch.model.JobSummary;
import com.whereq.dispatch.transport.SearchTransport;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Paged access to the search jobs collection.
 *
 * <p>{@link #iterate(int)} stops on a short page, or once the offset reaches the total when
 * the server reports one.
 *
 * <p>Listing entries carry the identifier under {@code name}, status entries under
 * {@code content.sid}; both end up in {@link JobSummary#getIdentifier()}.
 */
@Slf4j
public class JobListingPager {

    private final SearchTransport transport;
    private final StatusDecoder decoder;
    private final String jobsPath;
    private final Duration requestTimeout;

    public JobListingPager(SearchTransport transport, StatusDecoder decoder, String jobsPath, Duration requestTimeout) {
        this.transport = transport;
        this.decoder = decoder;
        this.jobsPath = jobsPath;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Fetch one page.
     *
     * @param count maximum entries, 0 lets the server decide
     * @param offset index of the first entry
     * @throws IllegalArgumentException if count or offset is negative
     */
    public JobPage page(int count, int offset) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, got " + count);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, got " + offset);
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("count", count);
        params.put("offset", offset);

        JsonNode response = transport.get(jobsPath, params, requestTimeout);

        List<JobSummary> jobs = new ArrayList<>();
        for (ResponseShape.Entry entry : ResponseShape.detect(response).entries(response)) {
            jobs.add(decoder.decodeSummary(entry));
        }

        JsonNode paging = response.path("paging");
        long total = FieldCoercion.safeLong(paging.get("total"), -1);
        JobPage page = JobPage.builder()
            .jobs(jobs)
            .total(total < 0 ? offset + jobs.size() : total)
            .totalReported(total >= 0)
            .offset(FieldCoercion.safeLong(paging.get("offset"), offset))
            .perPage(FieldCoercion.safeLong(paging.get("perPage"), count))
            .build();

        log.debug("Listed {} jobs (offset {}, total {})", jobs.size(), page.getOffset(), page.getTotal());
        return page;
    }

    /**
     * Lazily walk every job, one page request at a time.
     *
     * @param pageSize entries per request, must be positive
     */
    public Iterable<JobSummary> iterate(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive, got " + pageSize);
        }
        return () -> new PagingIterator(pageSize);
    }

    private final class PagingIterator implements Iterator<JobSummary> {

        private final int pageSize;
        private Iterator<JobSummary> current = List.<JobSummary>of().iterator();
        private int nextOffset;
        private boolean exhausted;

        private PagingIterator(int pageSize) {
            this.pageSize = pageSize;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext() && !exhausted) {
                JobPage page = page(pageSize, nextOffset);
                current = page.getJobs().iterator();
                nextOffset += page.getJobs().size();
                exhausted = page.getJobs().size() < pageSize
                    || (page.isTotalReported() && nextOffset >= page.getTotal());
            }
            return current.hasNext();
        }

        @Override
        public JobSummary next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
