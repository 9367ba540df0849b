package works.tally;

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * The value a field takes when an instance is constructed without one.
 * <p>
 * A {@link Constant} hands out the same object to every instance, so a mutable
 * constant is shared by all of them. Use {@link Computed} for mutable defaults:
 * its producer runs once per instance.
 */
public sealed interface DefaultValue {
	Object resolve();

	static DefaultValue of(Object value) {
		return new Constant(value);
	}

	static DefaultValue computed(Supplier<?> producer) {
		return new Computed(producer);
	}

	record Constant(Object value) implements DefaultValue {
		@Override
		public Object resolve() {
			return value;
		}
	}

	record Computed(Supplier<?> producer) implements DefaultValue {
		public Computed {
			requireNonNull(producer);
		}

		@Override
		public Object resolve() {
			return producer.get();
		}
	}
}
