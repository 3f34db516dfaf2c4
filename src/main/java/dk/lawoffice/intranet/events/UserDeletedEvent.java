package dk.lawoffice.intranet.events;

/**
 * Fired synchronously, inside the deleting transaction, before a user row is removed.
 * Observers delete the rows the user owns and detach the rows the user is only credited on.
 */
public record UserDeletedEvent(String useruuid) {
}
