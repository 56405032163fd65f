package com.github.dimitryivaniuta.linkorganizer.link;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/** Link payloads use camelCase keys ({@code categoryId}, {@code createdAt}). */
public final class LinkDtos {

    private LinkDtos() {
    }

    public record LinkCreateRequest(
            @NotBlank @Size(max = Link.TITLE_LENGTH) String title,
            @NotBlank @Size(max = Link.URL_LENGTH) String url,
            @Size(max = Link.DESCRIPTION_LENGTH) String description,
            Long categoryId,
            Boolean pinned
    ) {}

    /** Mutable fields of a link; absent (null) fields are left unchanged. */
    public record LinkUpdateRequest(
            @Size(min = 1, max = Link.TITLE_LENGTH) String title,
            @Size(min = 1, max = Link.URL_LENGTH) String url,
            @Size(max = Link.DESCRIPTION_LENGTH) String description,
            Long categoryId,
            Boolean pinned
    ) {}

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record LinkResponse(
            Long id,
            String title,
            String url,
            String description,
            Long categoryId,
            String categoryName,
            boolean pinned,
            Instant createdAt,
            Instant updatedAt
    ) {}
}
