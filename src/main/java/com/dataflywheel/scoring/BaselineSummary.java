package com.dataflywheel.scoring;

public record BaselineSummary(String modelIdentifier, double aggregateScore, int records, long skippedRecords) {
}
