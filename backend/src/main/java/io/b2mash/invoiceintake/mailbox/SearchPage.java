package io.b2mash.invoiceintake.mailbox;

import java.util.List;

public record SearchPage(List<CandidateMessage> messages, String nextPageToken) {

  public SearchPage {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }

  public boolean hasNextPage() {
    return nextPageToken != null && !nextPageToken.isBlank();
  }
}
