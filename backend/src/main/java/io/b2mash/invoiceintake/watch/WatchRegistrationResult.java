package io.b2mash.invoiceintake.watch;

import java.time.Instant;
import java.util.List;

/** Outcome of a watch (re-)registration, in the string form returned to admin callers. */
public record WatchRegistrationResult(
    String cursorBefore, String cursorAfter, Instant watchExpiry, List<String> labelFilter) {}
