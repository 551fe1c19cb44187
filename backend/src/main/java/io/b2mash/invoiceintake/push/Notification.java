package io.b2mash.invoiceintake.push;

import io.b2mash.invoiceintake.mailbox.HistoryMarker;

/** "Mailbox {@code mailboxAddress} changed up to {@code historyMarker}". Never persisted. */
public record Notification(String mailboxAddress, HistoryMarker historyMarker) {}
