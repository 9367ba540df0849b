package works.tally.store;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The primary key of an item, in wire representation.
 *
 * @param rangeKey null for tables without a range key
 */
public record ItemKey(Object hashKey, @Nullable Object rangeKey) {
	public ItemKey {
		requireNonNull(hashKey, "hashKey");
	}

	public static ItemKey of(Object hashKey) {
		return new ItemKey(hashKey, null);
	}

	public static ItemKey of(Object hashKey, @Nullable Object rangeKey) {
		return new ItemKey(hashKey, rangeKey);
	}

	@Override
	public String toString() {
		return (rangeKey == null) ? hashKey.toString() : hashKey + "/" + rangeKey;
	}
}
