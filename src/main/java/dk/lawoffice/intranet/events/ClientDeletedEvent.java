package dk.lawoffice.intranet.events;

/**
 * Fired inside the deleting transaction before a client row is removed.
 */
public record ClientDeletedEvent(String clientuuid) {
}
