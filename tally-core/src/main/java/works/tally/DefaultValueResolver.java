package works.tally;

/**
 * Computes the initial value of a field for a newly constructed instance.
 */
public final class DefaultValueResolver {
	private DefaultValueResolver() { }

	/**
	 * Called once per field per instance, and only for fields the
	 * constructor was not given a value for (an explicit null counts as given).
	 *
	 * @return the default, or null if the field has none.
	 */
	public static Object resolve(FieldDeclaration declaration) {
		DefaultValue defaultValue = declaration.options().defaultValue();
		if (defaultValue == null) {
			return null;
		} else {
			return defaultValue.resolve();
		}
	}
}
