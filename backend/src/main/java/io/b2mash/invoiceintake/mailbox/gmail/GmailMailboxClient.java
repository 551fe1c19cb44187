package io.b2mash.invoiceintake.mailbox.gmail;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.History;
import com.google.api.services.gmail.model.HistoryMessageAdded;
import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListHistoryResponse;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartBody;
import com.google.api.services.gmail.model.MessagePartHeader;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import com.google.api.services.gmail.model.WatchRequest;
import com.google.api.services.gmail.model.WatchResponse;
import io.b2mash.invoiceintake.config.IntakeProperties;
import io.b2mash.invoiceintake.mailbox.AttachmentRef;
import io.b2mash.invoiceintake.mailbox.CandidateMessage;
import io.b2mash.invoiceintake.mailbox.HistoryExpiredException;
import io.b2mash.invoiceintake.mailbox.HistoryMarker;
import io.b2mash.invoiceintake.mailbox.HistoryPage;
import io.b2mash.invoiceintake.mailbox.HistoryRecord;
import io.b2mash.invoiceintake.mailbox.MailMessage;
import io.b2mash.invoiceintake.mailbox.MailboxClient;
import io.b2mash.invoiceintake.mailbox.MailboxException;
import io.b2mash.invoiceintake.mailbox.SearchPage;
import io.b2mash.invoiceintake.mailbox.WatchRegistration;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Gmail implementation of {@link MailboxClient}. Gmail API types stay inside this class. */
@Component
@ConditionalOnProperty(
    name = "intake.mailbox.provider",
    havingValue = "gmail",
    matchIfMissing = true)
public class GmailMailboxClient implements MailboxClient {

  private static final Logger log = LoggerFactory.getLogger(GmailMailboxClient.class);

  private static final long HISTORY_PAGE_SIZE = 500;
  private static final String UNREAD = "UNREAD";

  private final Gmail gmail;
  private final GoogleApiRetry retry;
  private final String userId;
  private final Cache<String, String> labelIdsByName;

  @Autowired
  public GmailMailboxClient(Gmail gmail, IntakeProperties properties) {
    this(gmail, new GoogleApiRetry(), properties.mailbox().user());
  }

  GmailMailboxClient(Gmail gmail, GoogleApiRetry retry, String userId) {
    this.gmail = gmail;
    this.retry = retry;
    this.userId = userId;
    this.labelIdsByName =
        Caffeine.newBuilder().expireAfterWrite(Duration.ofHours(6)).maximumSize(100).build();
  }

  @Override
  public HistoryPage fetchHistory(HistoryMarker startCursor, String pageToken) {
    ListHistoryResponse response;
    try {
      response =
          retry.execute(
              "gmail.users.history.list",
              () ->
                  gmail
                      .users()
                      .history()
                      .list(userId)
                      .setStartHistoryId(startCursor.value())
                      .setHistoryTypes(List.of("messageAdded"))
                      .setPageToken(pageToken)
                      .setMaxResults(HISTORY_PAGE_SIZE)
                      .execute());
    } catch (MailboxException e) {
      if (GoogleApiRetry.httpStatus(e) == 404) {
        throw new HistoryExpiredException(startCursor, e);
      }
      throw e;
    }

    var records = new ArrayList<HistoryRecord>();
    if (response.getHistory() != null) {
      for (History history : response.getHistory()) {
        records.add(toRecord(history));
      }
    }
    HistoryMarker current =
        response.getHistoryId() != null
            ? HistoryMarker.parse(response.getHistoryId().toString())
            : null;
    return new HistoryPage(records, response.getNextPageToken(), current);
  }

  private static HistoryRecord toRecord(History history) {
    var added = new ArrayList<CandidateMessage>();
    if (history.getMessagesAdded() != null) {
      for (HistoryMessageAdded item : history.getMessagesAdded()) {
        Message message = item.getMessage();
        if (message == null || message.getId() == null || message.getId().isBlank()) {
          continue;
        }
        added.add(
            new CandidateMessage(
                message.getId().strip(),
                message.getThreadId(),
                message.getLabelIds() != null ? new HashSet<>(message.getLabelIds()) : null,
                false));
      }
    }
    HistoryMarker id =
        history.getId() != null ? HistoryMarker.parse(history.getId().toString()) : null;
    return new HistoryRecord(id, added);
  }

  @Override
  public SearchPage search(String query, String pageToken, int maxResults) {
    ListMessagesResponse response =
        retry.execute(
            "gmail.users.messages.list",
            () ->
                gmail
                    .users()
                    .messages()
                    .list(userId)
                    .setQ(query)
                    .setPageToken(pageToken)
                    .setMaxResults((long) maxResults)
                    .execute());

    var messages = new ArrayList<CandidateMessage>();
    if (response.getMessages() != null) {
      for (Message message : response.getMessages()) {
        if (message.getId() != null && !message.getId().isBlank()) {
          messages.add(new CandidateMessage(message.getId(), message.getThreadId(), null, true));
        }
      }
    }
    return new SearchPage(messages, response.getNextPageToken());
  }

  @Override
  public MailMessage getMessage(String messageId) {
    Message message =
        retry.execute(
            "gmail.users.messages.get",
            () -> gmail.users().messages().get(userId, messageId).setFormat("full").execute());

    var attachments = new ArrayList<AttachmentRef>();
    String subject = "";
    MessagePart payload = message.getPayload();
    if (payload != null) {
      subject = subjectOf(payload);
      Deque<MessagePart> stack = new ArrayDeque<>();
      stack.push(payload);
      while (!stack.isEmpty()) {
        MessagePart part = stack.pop();
        String filename = part.getFilename();
        if (filename != null && !filename.isBlank()) {
          MessagePartBody body = part.getBody();
          String attachmentId = body != null ? body.getAttachmentId() : null;
          byte[] inline = body != null && body.getData() != null ? body.decodeData() : null;
          attachments.add(new AttachmentRef(filename.strip(), attachmentId, inline));
        }
        if (part.getParts() != null) {
          part.getParts().forEach(stack::push);
        }
      }
    }
    return new MailMessage(
        message.getId(),
        message.getThreadId(),
        subject,
        message.getLabelIds() != null ? new HashSet<>(message.getLabelIds()) : null,
        attachments);
  }

  private static String subjectOf(MessagePart payload) {
    if (payload.getHeaders() == null) {
      return "";
    }
    for (MessagePartHeader header : payload.getHeaders()) {
      if ("subject".equalsIgnoreCase(header.getName())) {
        return header.getValue() != null ? header.getValue().strip() : "";
      }
    }
    return "";
  }

  @Override
  public byte[] getAttachment(String messageId, AttachmentRef attachment) {
    if (attachment.attachmentId() == null) {
      if (attachment.inlineData() == null) {
        throw new MailboxException("Attachment " + attachment.filename() + " has no content");
      }
      return attachment.inlineData();
    }
    MessagePartBody body =
        retry.execute(
            "gmail.users.messages.attachments.get",
            () ->
                gmail
                    .users()
                    .messages()
                    .attachments()
                    .get(userId, messageId, attachment.attachmentId())
                    .execute());
    if (body.getData() == null) {
      throw new MailboxException("Attachment " + attachment.filename() + " returned no data");
    }
    return body.decodeData();
  }

  @Override
  public String resolveLabelId(String labelName) {
    return labelIdsByName.get(labelName, this::findOrCreateLabel);
  }

  private String findOrCreateLabel(String labelName) {
    var listed =
        retry.execute(
            "gmail.users.labels.list", () -> gmail.users().labels().list(userId).execute());
    if (listed.getLabels() != null) {
      for (Label label : listed.getLabels()) {
        if (labelName.equals(label.getName())) {
          return label.getId();
        }
      }
    }
    var request =
        new Label()
            .setName(labelName)
            .setLabelListVisibility("labelShow")
            .setMessageListVisibility("show");
    Label created =
        retry.execute(
            "gmail.users.labels.create",
            () -> gmail.users().labels().create(userId, request).execute());
    log.info("Created mailbox label {} with id {}", labelName, created.getId());
    return created.getId();
  }

  @Override
  public void applyLabel(String messageId, String labelId, boolean markAsRead) {
    var request =
        new ModifyMessageRequest()
            .setAddLabelIds(List.of(labelId))
            .setRemoveLabelIds(markAsRead ? List.of(UNREAD) : List.of());
    retry.execute(
        "gmail.users.messages.modify",
        () -> gmail.users().messages().modify(userId, messageId, request).execute());
  }

  @Override
  public WatchRegistration createOrRenewWatch(
      String topic, List<String> labelIds, String labelFilterAction) {
    var request = new WatchRequest().setTopicName(topic);
    if (!labelIds.isEmpty()) {
      request.setLabelIds(labelIds).setLabelFilterAction(labelFilterAction);
    }
    WatchResponse response =
        retry.execute("gmail.users.watch", () -> gmail.users().watch(userId, request).execute());
    if (response.getHistoryId() == null) {
      throw new MailboxException("Watch response carried no historyId");
    }
    Instant expiry =
        response.getExpiration() != null ? Instant.ofEpochMilli(response.getExpiration()) : null;
    return new WatchRegistration(HistoryMarker.parse(response.getHistoryId().toString()), expiry);
  }
}
