package works.tally;

/**
 * Which fields {@link Marshaller#attributesForWrite} includes.
 */
public enum WriteMode {
	/**
	 * Every field, including nulls, for a put that replaces the whole item.
	 */
	FULL,

	/**
	 * Only fields the {@link DirtyLedger} reports as changed, for a partial update.
	 */
	CHANGED,
}
