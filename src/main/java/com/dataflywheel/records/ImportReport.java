package com.dataflywheel.records;

public record ImportReport(int read, int stored, int duplicates) {
}
