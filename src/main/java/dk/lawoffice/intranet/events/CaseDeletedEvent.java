package dk.lawoffice.intranet.events;

/**
 * Fired inside the deleting transaction before a case row is removed.
 */
public record CaseDeletedEvent(String caseuuid) {
}
