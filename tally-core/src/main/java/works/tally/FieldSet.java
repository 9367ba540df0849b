package works.tally;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.pcollections.HashTreePMap;
import org.pcollections.OrderedPSet;
import org.pcollections.PMap;

/**
 * An immutable, ordered collection of {@link FieldDeclaration}s keyed by field name.
 * <p>
 * Redeclaring a name replaces its declaration and keeps its position.
 * Because the underlying collections are persistent, taking a snapshot of a
 * field set is free; a {@link DocumentClass} subclass starts from its parent's
 * snapshot and diverges from there.
 */
public final class FieldSet implements Iterable<FieldDeclaration> {
	private static final FieldSet EMPTY = new FieldSet(OrderedPSet.empty(), HashTreePMap.empty());

	private final OrderedPSet<String> names;
	private final PMap<String, FieldDeclaration> declarations;

	private FieldSet(OrderedPSet<String> names, PMap<String, FieldDeclaration> declarations) {
		this.names = names;
		this.declarations = declarations;
	}

	public static FieldSet empty() {
		return EMPTY;
	}

	public FieldSet plus(FieldDeclaration declaration) {
		return new FieldSet(names.plus(declaration.name()), declarations.plus(declaration.name(), declaration));
	}

	public FieldSet minus(String name) {
		return new FieldSet(names.minus(name), declarations.minus(name));
	}

	public boolean contains(String name) {
		return declarations.containsKey(name);
	}

	public Optional<FieldDeclaration> get(String name) {
		return Optional.ofNullable(declarations.get(name));
	}

	public List<String> names() {
		return List.copyOf(names);
	}

	public int size() {
		return names.size();
	}

	public Stream<FieldDeclaration> stream() {
		return StreamSupport.stream(spliterator(), false);
	}

	@Override
	public Iterator<FieldDeclaration> iterator() {
		List<FieldDeclaration> result = new ArrayList<>(names.size());
		for (String name: names) {
			result.add(declarations.get(name));
		}
		return result.iterator();
	}

	@Override
	public String toString() {
		return "FieldSet" + names;
	}
}
