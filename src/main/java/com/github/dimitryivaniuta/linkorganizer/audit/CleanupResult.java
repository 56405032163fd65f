package com.github.dimitryivaniuta.linkorganizer.audit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CleanupResult(int deletedCount, int daysKept) {}
