package hookrelay.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An application event as published by the domain (ticket created, comment added, ...).
 *
 * <p>Serialized into webhook envelopes as {@code {"type": "<tag>", ...attributes}}.
 * Attribute values may be anything Jackson can serialize.
 *
 * @param kind       which event this is
 * @param attributes event body, in insertion order
 */
public record DomainEvent(Kind kind, Map<String, Object> attributes) {

  public DomainEvent {
    Objects.requireNonNull(kind, "kind");
    attributes = attributes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public static DomainEvent of(Kind kind, Map<String, Object> attributes) {
    return new DomainEvent(kind, attributes);
  }

  public static DomainEvent of(Kind kind) {
    return new DomainEvent(kind, Map.of());
  }

  /** Every kind of event the domain can publish. */
  public enum Kind {
    TICKET_CREATED("TicketCreated"),
    TICKET_UPDATED("TicketUpdated"),
    TICKET_DELETED("TicketDeleted"),
    COMMENT_ADDED("CommentAdded"),
    COMMENT_DELETED("CommentDeleted"),
    ATTACHMENT_ADDED("AttachmentAdded"),
    ATTACHMENT_DELETED("AttachmentDeleted"),
    DEVICE_CREATED("DeviceCreated"),
    DEVICE_LINKED("DeviceLinked"),
    DEVICE_UNLINKED("DeviceUnlinked"),
    DEVICE_UPDATED("DeviceUpdated"),
    PROJECT_ASSIGNED("ProjectAssigned"),
    PROJECT_UNASSIGNED("ProjectUnassigned"),
    TICKET_LINKED("TicketLinked"),
    TICKET_UNLINKED("TicketUnlinked"),
    DOCUMENTATION_CREATED("DocumentationCreated"),
    DOCUMENTATION_UPDATED("DocumentationUpdated"),
    USER_CREATED("UserCreated"),
    USER_UPDATED("UserUpdated"),
    USER_DELETED("UserDeleted"),
    HEARTBEAT("Heartbeat"),
    VIEWER_COUNT_CHANGED("ViewerCountChanged"),
    NOTIFICATION_RECEIVED("NotificationReceived");

    private final String tag;

    Kind(String tag) {
      this.tag = tag;
    }

    /** The {@code type} value written into serialized events. */
    public String tag() {
      return tag;
    }
  }
}
