package com.github.dimitryivaniuta.linkorganizer.link;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CategoryLinks(String categoryName, Long linksCount) {}
