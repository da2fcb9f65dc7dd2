package hookrelay;

import hookrelay.event.DomainEvent;

import java.util.Arrays;
import java.util.List;

/**
 * Event types an endpoint can subscribe to, with their dotted wire names.
 */
public enum WebhookEventType {
  TICKET_CREATED("ticket.created"),
  TICKET_UPDATED("ticket.updated"),
  TICKET_DELETED("ticket.deleted"),
  COMMENT_ADDED("comment.added"),
  COMMENT_DELETED("comment.deleted"),
  ATTACHMENT_ADDED("attachment.added"),
  ATTACHMENT_DELETED("attachment.deleted"),
  DEVICE_CREATED("device.created"),
  DEVICE_LINKED("device.linked"),
  DEVICE_UNLINKED("device.unlinked"),
  DEVICE_UPDATED("device.updated"),
  PROJECT_ASSIGNED("project.assigned"),
  PROJECT_UNASSIGNED("project.unassigned"),
  TICKET_LINKED("ticket.linked"),
  TICKET_UNLINKED("ticket.unlinked"),
  DOCUMENTATION_CREATED("documentation.created"),
  DOCUMENTATION_UPDATED("documentation.updated"),
  USER_CREATED("user.created"),
  USER_UPDATED("user.updated"),
  USER_DELETED("user.deleted");

  private static final List<String> ALL =
      Arrays.stream(values()).map(WebhookEventType::wireName).toList();

  private final String wireName;

  WebhookEventType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Lists every subscribable wire name, in declaration order.
   *
   * @return unmodifiable list of event type names
   */
  public static List<String> all() {
    return ALL;
  }

  /**
   * Looks up an event type by wire name.
   *
   * @param wireName dotted name such as {@code comment.added}
   * @return the matching type
   * @throws IllegalArgumentException if the name is unknown
   */
  public static WebhookEventType fromWireName(String wireName) {
    for (WebhookEventType type : values()) {
      if (type.wireName.equals(wireName)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown webhook event type: " + wireName);
  }

  /**
   * Maps a domain event kind to the webhook event type it produces.
   *
   * @param kind the domain event kind
   * @return the event type, or {@code null} for internal events that are never
   *     sent to webhooks (heartbeats, viewer counts, notifications)
   */
  public static WebhookEventType forDomainEvent(DomainEvent.Kind kind) {
    return switch (kind) {
      case TICKET_CREATED -> TICKET_CREATED;
      case TICKET_UPDATED -> TICKET_UPDATED;
      case TICKET_DELETED -> TICKET_DELETED;
      case COMMENT_ADDED -> COMMENT_ADDED;
      case COMMENT_DELETED -> COMMENT_DELETED;
      case ATTACHMENT_ADDED -> ATTACHMENT_ADDED;
      case ATTACHMENT_DELETED -> ATTACHMENT_DELETED;
      case DEVICE_CREATED -> DEVICE_CREATED;
      case DEVICE_LINKED -> DEVICE_LINKED;
      case DEVICE_UNLINKED -> DEVICE_UNLINKED;
      case DEVICE_UPDATED -> DEVICE_UPDATED;
      case PROJECT_ASSIGNED -> PROJECT_ASSIGNED;
      case PROJECT_UNASSIGNED -> PROJECT_UNASSIGNED;
      case TICKET_LINKED -> TICKET_LINKED;
      case TICKET_UNLINKED -> TICKET_UNLINKED;
      case DOCUMENTATION_CREATED -> DOCUMENTATION_CREATED;
      case DOCUMENTATION_UPDATED -> DOCUMENTATION_UPDATED;
      case USER_CREATED -> USER_CREATED;
      case USER_UPDATED -> USER_UPDATED;
      case USER_DELETED -> USER_DELETED;
      case HEARTBEAT, VIEWER_COUNT_CHANGED, NOTIFICATION_RECEIVED -> null;
    };
  }
}
