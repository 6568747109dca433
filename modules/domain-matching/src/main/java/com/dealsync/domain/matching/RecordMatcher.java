package com.dealsync.domain.matching;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs side-A records with side-B records sharing the same match key.
 *
 * <p>Each side-B record is consumed at most once. Among several side-B candidates with the same
 * key, the first one in input order that is still available wins, even when a later candidate
 * would be a closer value match. Results are therefore deterministic for a fixed input order but
 * not globally optimal.
 */
public class RecordMatcher {
  private static final Logger log = LoggerFactory.getLogger(RecordMatcher.class);

  private final ValueTolerance tolerance;

  public RecordMatcher(ValueTolerance tolerance) {
    this.tolerance = Objects.requireNonNull(tolerance, "tolerance must not be null");
  }

  public MatchResult match(List<CanonicalRecord> sideA, List<CanonicalRecord> sideB) {
    Objects.requireNonNull(sideA, "sideA must not be null");
    Objects.requireNonNull(sideB, "sideB must not be null");

    Map<String, List<CanonicalRecord>> candidatesByKey = indexByKey(sideB);
    Set<CanonicalRecord> consumed = Collections.newSetFromMap(new IdentityHashMap<>());
    List<ProjectMatch> matches = new ArrayList<>();
    List<CanonicalRecord> unmatchedA = new ArrayList<>();

    for (CanonicalRecord record : sideA) {
      String key = MatchKeyGenerator.generate(record.name());
      if (key.isEmpty()) {
        log.warn("Skipping side-A record with empty match key recordId={}", record.id());
        unmatchedA.add(record);
        continue;
      }

      CanonicalRecord candidate = firstAvailable(candidatesByKey.get(key), consumed);
      if (candidate == null) {
        unmatchedA.add(record);
        continue;
      }
      consumed.add(candidate);
      matches.add(toMatch(record, candidate, key));
    }

    List<CanonicalRecord> unmatchedB = new ArrayList<>();
    for (CanonicalRecord record : sideB) {
      if (!consumed.contains(record)) {
        unmatchedB.add(record);
      }
    }

    log.info(
        "Record matching completed sideA={} sideB={} matched={} unmatchedA={} unmatchedB={}",
        sideA.size(),
        sideB.size(),
        matches.size(),
        unmatchedA.size(),
        unmatchedB.size());
    return new MatchResult(matches, unmatchedA, unmatchedB);
  }

  private Map<String, List<CanonicalRecord>> indexByKey(List<CanonicalRecord> records) {
    Map<String, List<CanonicalRecord>> index = new LinkedHashMap<>();
    for (CanonicalRecord record : records) {
      String key = MatchKeyGenerator.generate(record.name());
      if (key.isEmpty()) {
        log.warn("Skipping side-B record with empty match key recordId={}", record.id());
        continue;
      }
      index.computeIfAbsent(key, ignored -> new ArrayList<>()).add(record);
    }
    return index;
  }

  private static CanonicalRecord firstAvailable(
      List<CanonicalRecord> candidates, Set<CanonicalRecord> consumed) {
    if (candidates == null) {
      return null;
    }
    for (CanonicalRecord candidate : candidates) {
      if (!consumed.contains(candidate)) {
        return candidate;
      }
    }
    return null;
  }

  private ProjectMatch toMatch(CanonicalRecord sideA, CanonicalRecord sideB, String key) {
    return new ProjectMatch(
        sideA,
        sideB,
        key,
        tolerance.matches(sideA.value(), sideB.value()),
        sideA.value().subtract(sideB.value()).abs(),
        tolerance.differencePercentage(sideA.value(), sideB.value()));
  }
}
