/**
 * Exceptions that can reach the user of tally.
 * <p>
 * All are unchecked, and all are thrown at the call that caused them
 * rather than being deferred to synchronization time.
 */
package works.tally.exceptions;
