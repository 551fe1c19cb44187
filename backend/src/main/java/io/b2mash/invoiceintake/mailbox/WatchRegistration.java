package io.b2mash.invoiceintake.mailbox;

import java.time.Instant;

/** Result of (re-)registering a push watch: the mailbox position at registration and its expiry. */
public record WatchRegistration(HistoryMarker cursor, Instant expiry) {}
