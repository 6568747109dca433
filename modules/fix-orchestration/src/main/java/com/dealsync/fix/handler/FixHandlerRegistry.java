package com.dealsync.fix.handler;

import com.dealsync.fix.issue.IssueCode;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes issue codes to handlers. The switch over {@link IssueCode} is exhaustive, so a new code
 * does not compile until its routing is decided here.
 */
public class FixHandlerRegistry {
  private static final Logger log = LoggerFactory.getLogger(FixHandlerRegistry.class);

  private final FixHandler titleFormatHandler;

  public FixHandlerRegistry(FixHandler titleFormatHandler) {
    this.titleFormatHandler =
        Objects.requireNonNull(titleFormatHandler, "titleFormatHandler must not be null");
    if (!titleFormatHandler.supportedCodes().contains(IssueCode.INVALID_TITLE_FORMAT)) {
      throw new IllegalArgumentException(
          "Handler " + titleFormatHandler.handlerId() + " does not support INVALID_TITLE_FORMAT");
    }
    log.info(
        "Registered fix handler handlerId={} supportedCodes={}",
        titleFormatHandler.handlerId(),
        titleFormatHandler.supportedCodes());
  }

  public Optional<FixHandler> resolve(IssueCode code) {
    if (code == null) {
      return Optional.empty();
    }
    FixHandler handler =
        switch (code) {
          case INVALID_TITLE_FORMAT -> titleFormatHandler;
          // pipeline placement needs a human decision
          case WON_DEAL_IN_UNQUALIFIED_PIPELINE, OPEN_DEAL_IN_WRONG_PIPELINE -> null;
          case MISSING_VESSEL,
              VALUE_MISMATCH,
              QUOTE_VALUE_MISMATCH,
              QUOTE_CURRENCY_MISMATCH,
              UNRECOGNIZED -> null;
        };
    return Optional.ofNullable(handler);
  }
}
