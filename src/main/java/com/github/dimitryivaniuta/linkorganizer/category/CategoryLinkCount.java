package com.github.dimitryivaniuta.linkorganizer.category;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CategoryLinkCount(Long id, String name, Long linksCount) {}
