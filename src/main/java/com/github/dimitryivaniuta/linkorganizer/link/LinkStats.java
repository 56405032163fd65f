package com.github.dimitryivaniuta.linkorganizer.link;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LinkStats(
        long totalLinks,
        long pinnedLinks,
        long uncategorizedLinks,
        List<CategoryLinks> linksPerCategory
) {}
