package com.textsplit.ingest;

import java.util.List;

public record SplitRecord(
    long lineNumber,
    List<String> tokens
) {
}
