package works.tally;

/**
 * What a query planner or schema tool needs to know about a field,
 * without access to its default or serializer.
 */
public record FieldMetadata(
	String name,
	FieldType type,
	boolean hasDefault,
	String wireName
) {
	static FieldMetadata of(FieldDeclaration declaration) {
		return new FieldMetadata(declaration.name(), declaration.type(), declaration.hasDefault(), declaration.wireName());
	}
}
