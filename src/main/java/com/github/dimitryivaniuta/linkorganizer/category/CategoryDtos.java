package com.github.dimitryivaniuta.linkorganizer.category;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public final class CategoryDtos {

    private CategoryDtos() {
    }

    public record CategoryCreateRequest(
            @NotBlank @Size(max = Category.NAME_LENGTH) String name,
            @Size(max = Category.DESCRIPTION_LENGTH) String description
    ) {}

    /** Mutable fields of a category; absent (null) fields are left unchanged. */
    public record CategoryUpdateRequest(
            @Size(min = 1, max = Category.NAME_LENGTH) String name,
            @Size(max = Category.DESCRIPTION_LENGTH) String description
    ) {}

    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CategoryResponse(
            Long id,
            String name,
            String description,
            Instant createdAt,
            Instant updatedAt,
            long linksCount
    ) {}
}
