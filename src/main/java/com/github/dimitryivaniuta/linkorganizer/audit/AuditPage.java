package com.github.dimitryivaniuta.linkorganizer.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditPage<T>(
        @JsonProperty("errors") List<T> records,
        long total,
        int page,
        int perPage,
        int pages,
        boolean hasNext,
        boolean hasPrev
) {

    static <T> AuditPage<T> of(Page<T> p, int page, int perPage) {
        return new AuditPage<>(
                p.getContent(),
                p.getTotalElements(),
                page,
                perPage,
                p.getTotalPages(),
                p.hasNext(),
                page > 1
        );
    }

    /** Empty page for a page number whose offset lies past anything the store can address. */
    static <T> AuditPage<T> beyondEnd(long total, int page, int perPage) {
        int pages = (int) Math.min(Integer.MAX_VALUE, (total + perPage - 1) / perPage);
        return new AuditPage<>(List.of(), total, page, perPage, pages, false, true);
    }

    public <R> AuditPage<R> map(Function<? super T, ? extends R> fn) {
        List<R> mapped = records.stream().<R>map(fn).toList();
        return new AuditPage<>(mapped, total, page, perPage, pages, hasNext, hasPrev);
    }
}
