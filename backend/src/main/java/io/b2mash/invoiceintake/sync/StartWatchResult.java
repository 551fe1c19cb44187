package io.b2mash.invoiceintake.sync;

import io.b2mash.invoiceintake.watch.WatchRegistrationResult;

/** Watch registration plus the drain sync that follows it; {@code sync} is null when disabled. */
public record StartWatchResult(WatchRegistrationResult registration, SyncSummary sync) {}
