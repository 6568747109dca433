package com.dealsync.domain.matching;

public record UnmatchedRecord(CanonicalRecord record, String matchKey) {}
