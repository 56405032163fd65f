package com.github.dimitryivaniuta.linkorganizer.category;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CategoryStats(long totalCategories, List<CategoryLinkCount> categoriesWithLinks) {}
