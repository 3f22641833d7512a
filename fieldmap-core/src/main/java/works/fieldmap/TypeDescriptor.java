package works.fieldmap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * The ultimate product of a {@link FieldScanner}:
 * all the fields reachable from one class, in breadth-first discovery order.
 * Immutable.
 * <p>
 * Because outer fields are discovered before the fields of embedded objects,
 * {@link #getByPath} gives outer fields precedence when two fields share a path.
 */
public final class TypeDescriptor {
	private final Class<?> type;
	private final List<FieldDescriptor> fields;

	public TypeDescriptor(Class<?> type, List<FieldDescriptor> fields) {
		this.type = requireNonNull(type);
		this.fields = List.copyOf(fields);
	}

	public Class<?> type() {
		return type;
	}

	public List<FieldDescriptor> fields() {
		return fields;
	}

	public int size() {
		return fields.size();
	}

	public List<String> paths() {
		return fields.stream().map(FieldDescriptor::path).toList();
	}

	/**
	 * @return the first field, in discovery order, whose {@link FieldDescriptor#path path} is {@code path}
	 */
	public Optional<FieldDescriptor> getByPath(String path) {
		for (FieldDescriptor fd : fields) {
			if (fd.path().equals(path)) {
				return Optional.of(fd);
			}
		}
		return Optional.empty();
	}

	/**
	 * @return the field whose {@link FieldDescriptor#traversal traversal} equals the given one.
	 * A prefix doesn't count.
	 */
	public Optional<FieldDescriptor> getByTraversal(Traversal traversal) {
		for (FieldDescriptor fd : fields) {
			if (fd.traversal().equals(traversal)) {
				return Optional.of(fd);
			}
		}
		return Optional.empty();
	}

	/**
	 * Named fields by path, omitting embedded objects and fields with no name.
	 * <p>
	 * <em>Note</em>: when paths collide, the deeper field wins here,
	 * which is the opposite of {@link #getByPath}.
	 */
	public Map<String, FieldDescriptor> fieldMap() {
		Map<String, FieldDescriptor> result = new LinkedHashMap<>();
		for (FieldDescriptor fd : fields) {
			if (!fd.name().isEmpty() && !fd.embedded()) {
				result.put(fd.path(), fd);
			}
		}
		return unmodifiableMap(result);
	}

	@Override
	public String toString() {
		return "TypeDescriptor(" + type.getSimpleName() + ": " + paths() + ")";
	}
}
