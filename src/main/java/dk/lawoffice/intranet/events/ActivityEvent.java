package dk.lawoffice.intranet.events;

/**
 * Something a user did that belongs in their activity feed. Fired synchronously by the
 * services after a successful mutation; the feed row is written in the same transaction.
 */
public record ActivityEvent(String useruuid, ActivityType type, String description, String relatedObjectId) {
}
