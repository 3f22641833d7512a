package works.fieldmap;

import java.lang.reflect.Field;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Everything {@link FieldScanner} learned about one field reachable from a class.
 *
 * @param traversal how to reach the field from the root object
 * @param path the logical names of the enclosing fields and this one, joined with dots;
 *             this is what {@link TypeDescriptor#getByPath} matches
 * @param name the logical name of this field alone
 * @param field the reflective handle
 * @param type the generic declared type of {@code field}
 * @param zero the value of an unassigned field of this type; {@code null} except for primitives
 * @param options parsed from the comma-separated suffix of the raw name
 * @param embedded true if this descriptor represents an {@link works.fieldmap.annotations.Embedded Embedded}
 *                 object whose fields have been promoted into the enclosing namespace
 * @param mappedTag the raw tag value after the {@link NamingPolicy#tagMapper() tag mapper};
 *                  {@code null} if the field has no tag for the active key
 */
public record FieldDescriptor(
	Traversal traversal,
	String path,
	String name,
	Field field,
	Type type,
	@Nullable Object zero,
	Map<String, String> options,
	boolean embedded,
	@Nullable String mappedTag
) {
	public FieldDescriptor {
		requireNonNull(traversal);
		requireNonNull(path);
		requireNonNull(name);
		requireNonNull(field);
		requireNonNull(type);
		options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
	}

	public Class<?> rawType() {
		return field.getType();
	}

	public boolean hasOption(String key) {
		return options.containsKey(key);
	}

	public Optional<String> option(String key) {
		return Optional.ofNullable(options.get(key));
	}

	@Override
	public String toString() {
		return "FieldDescriptor(" + path + " @ " + traversal
			+ (options.isEmpty() ? "" : " " + options)
			+ (embedded ? " embedded" : "")
			+ ")";
	}
}
