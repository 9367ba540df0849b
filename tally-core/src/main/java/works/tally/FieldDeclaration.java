package works.tally;

import static java.util.Objects.requireNonNull;

/**
 * One named, typed field of a {@link DocumentClass}.
 */
public record FieldDeclaration(
	String name,
	FieldType type,
	FieldOptions options
) {
	public FieldDeclaration {
		requireNonNull(name);
		requireNonNull(type);
		requireNonNull(options);
	}

	public static FieldDeclaration of(String name, FieldType type) {
		return new FieldDeclaration(name, type, FieldOptions.NONE);
	}

	/**
	 * @return the attribute name used by the store, which is the
	 * field name unless {@link FieldOptions#storeAs() storeAs} is set.
	 */
	public String wireName() {
		String alias = options.storeAs();
		return (alias == null) ? name : alias;
	}

	public boolean hasDefault() {
		return options.defaultValue() != null;
	}
}
