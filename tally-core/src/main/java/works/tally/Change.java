package works.tally;

/**
 * The value of a field at the last clean point, and its value now.
 */
public record Change(Object before, Object after) { }
