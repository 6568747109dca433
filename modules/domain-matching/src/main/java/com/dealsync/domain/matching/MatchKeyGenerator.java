package com.dealsync.domain.matching;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the canonical matching key of a record name. Two records are candidate-equivalent when
 * their keys are equal. The function is total: blank or missing names yield an empty key.
 */
public final class MatchKeyGenerator {
  private static final Logger log = LoggerFactory.getLogger(MatchKeyGenerator.class);

  private static final Pattern TRAILING_COUNTER = Pattern.compile("\\s*\\(\\d+\\)\\s*$");
  private static final Pattern SEPARATED_CODE =
      Pattern.compile("^([A-Z]+\\d+)\\s*[-\\s]+\\s*(.+)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern COMPACT_CODE = Pattern.compile("^([A-Z]+\\d+)([A-Za-z].*)$");
  private static final Pattern LABELLED_NUMBER =
      Pattern.compile("(?:project|job|client)?[\\s-]*(\\d{3,})", Pattern.CASE_INSENSITIVE);
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9]+");

  private MatchKeyGenerator() {}

  public static String generate(String name) {
    if (name == null || name.isBlank()) {
      log.debug("Match key requested for blank name");
      return "";
    }

    String cleanName = TRAILING_COUNTER.matcher(name).replaceFirst("").trim();

    Matcher separated = SEPARATED_CODE.matcher(cleanName);
    if (separated.matches()) {
      return compose(separated.group(1), separated.group(2));
    }

    Matcher compact = COMPACT_CODE.matcher(cleanName);
    if (compact.matches()) {
      return compose(compact.group(1), compact.group(2));
    }

    Matcher labelled = LABELLED_NUMBER.matcher(cleanName);
    if (labelled.find()) {
      String remaining =
          cleanName.substring(0, labelled.start()) + cleanName.substring(labelled.end());
      return labelled.group(1) + "-" + alphanumericLower(remaining);
    }

    return alphanumericLower(cleanName);
  }

  private static String compose(String code, String remainder) {
    return code.toLowerCase(Locale.ROOT) + "-" + alphanumericLower(remainder.trim());
  }

  private static String alphanumericLower(String value) {
    return NON_ALPHANUMERIC.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
  }
}
