package works.fieldmap;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Maps logical names to fields of structured objects, obeying a {@link NamingPolicy}.
 * <p>
 * The {@link TypeDescriptor} for each class is computed by a {@link FieldScanner}
 * the first time it's needed, and cached for the life of the {@code Mapper}.
 * All population of the cache, scanning included, happens while holding this object's monitor,
 * so a given class is scanned at most once.
 * Descriptors are immutable, so once obtained they can be used without further locking.
 * <p>
 * The objects passed to the lookup methods are not protected in any way;
 * callers must not race on the same object.
 */
public class Mapper {
	private final FieldScanner scanner;

	/**
	 * Only ever replaced while holding the monitor.
	 * Persistent so {@link #knownTypes()} can read it without locking.
	 */
	private volatile PMap<Class<?>, TypeDescriptor> cache = HashTreePMap.empty();

	public Mapper(NamingPolicy policy) {
		this(new FieldScanner(policy));
	}

	Mapper(FieldScanner scanner) {
		this.scanner = requireNonNull(scanner);
	}

	/**
	 * @param tagKey obey {@link works.fieldmap.annotations.Tag Tag}s with this key; empty string to ignore tags
	 */
	public static Mapper forTag(String tagKey) {
		return new Mapper(NamingPolicy.builder()
			.tagKey(tagKey)
			.build());
	}

	/**
	 * Tags take precedence; fields without a tag are named {@code nameMapper(fieldName)}.
	 */
	public static Mapper forTag(String tagKey, UnaryOperator<String> nameMapper) {
		return new Mapper(NamingPolicy.builder()
			.tagKey(tagKey)
			.nameMapper(nameMapper)
			.build());
	}

	/**
	 * Like {@link #forTag(String, UnaryOperator)}, with a {@code tagMapper} to compute
	 * each {@link FieldDescriptor#mappedTag()}. This is useful for tags with options,
	 * like {@code "name,omitempty"}.
	 */
	public static Mapper forTag(String tagKey, @Nullable UnaryOperator<String> nameMapper, @Nullable UnaryOperator<String> tagMapper) {
		return new Mapper(NamingPolicy.builder()
			.tagKey(tagKey)
			.nameMapper(nameMapper)
			.tagMapper(tagMapper)
			.build());
	}

	public NamingPolicy namingPolicy() {
		return scanner.policy();
	}

	/**
	 * @param type a {@link TypeKind#STRUCT STRUCT} class, or an {@code Optional} of one
	 * @return the descriptor for the class, the same object on every call
	 * @throws works.fieldmap.exceptions.InvalidUsageException if {@code type} is not a struct
	 */
	public synchronized TypeDescriptor typeDescriptorFor(Type type) {
		Class<?> key = Types.requireStruct(Types.rawClass(Types.deref(type)));
		TypeDescriptor result = cache.get(key);
		if (result == null) {
			result = scanner.scan(key);
			cache = cache.plus(key, result);
			LOGGER.debug("Cached {}", result);
		}
		return result;
	}

	/**
	 * @return the classes whose descriptors have been computed so far
	 */
	public Set<Class<?>> knownTypes() {
		return Collections.unmodifiableSet(cache.keySet());
	}

	/**
	 * Returns the value of the field at {@code path}, allocating any missing objects along the way
	 * as {@link Accessors#fieldByTraversal} does.
	 * <p>
	 * <em>Note</em>: if there is no such field, this returns {@code record} itself
	 * ({@link Types#indirect unwrapped} if it's an {@code Optional}).
	 * Use {@link #findField} to tell a miss apart from a hit.
	 *
	 * @throws works.fieldmap.exceptions.InvalidUsageException if {@code record} is not a struct
	 */
	@Nullable
	public Object fieldByName(Object record, String path) {
		Object target = Types.indirect(record);
		Types.requireStruct(target);
		Optional<FieldDescriptor> fd = typeDescriptorFor(target.getClass()).getByPath(path);
		if (fd.isPresent()) {
			return Accessors.fieldByTraversal(target, fd.get().traversal()).get();
		} else {
			return target;
		}
	}

	/**
	 * @return a writable ref to the field at {@code path}, allocating any missing objects along the way;
	 * or empty if there is no such field
	 * @throws works.fieldmap.exceptions.InvalidUsageException if {@code record} is not a struct
	 */
	public Optional<FieldRef> findField(Object record, String path) {
		Object target = Types.indirect(record);
		Types.requireStruct(target);
		return typeDescriptorFor(target.getClass())
			.getByPath(path)
			.map(fd -> Accessors.fieldByTraversal(target, fd.traversal()));
	}

	/**
	 * Like {@link #fieldByName} for each of the {@code paths}, except that a missing field
	 * gives {@code null}.
	 *
	 * @return a list corresponding position-for-position with {@code paths}
	 * @throws works.fieldmap.exceptions.InvalidUsageException if {@code record} is not a struct
	 */
	public List<Object> fieldsByName(Object record, List<String> paths) {
		Object target = Types.indirect(record);
		Types.requireStruct(target);
		TypeDescriptor td = typeDescriptorFor(target.getClass());
		List<Object> result = new ArrayList<>(paths.size());
		for (String path : paths) {
			Optional<FieldDescriptor> fd = td.getByPath(path);
			if (fd.isPresent()) {
				result.add(Accessors.fieldByTraversal(target, fd.get().traversal()).get());
			} else {
				result.add(null);
			}
		}
		return result;
	}

	/**
	 * @return the {@link Traversal} for each of the {@code paths}, position-for-position,
	 * with {@link Traversal#EMPTY} for any that don't exist
	 * @throws works.fieldmap.exceptions.InvalidUsageException if {@code type} is not a struct
	 */
	public List<Traversal> traversalsByName(Type type, List<String> paths) {
		Class<?> struct = Types.requireStruct(Types.rawClass(Types.deref(type)));
		TypeDescriptor td = typeDescriptorFor(struct);
		List<Traversal> result = new ArrayList<>(paths.size());
		for (String path : paths) {
			result.add(td.getByPath(path)
				.map(FieldDescriptor::traversal)
				.orElse(Traversal.EMPTY));
		}
		return result;
	}

	/**
	 * Reads every entry of {@link TypeDescriptor#fieldMap()} from {@code record}
	 * without modifying it. Fields beneath a missing object read as their zero value.
	 *
	 * @return a map from path to value, in discovery order; values may be {@code null}
	 * @throws works.fieldmap.exceptions.InvalidUsageException if {@code record} is not a struct
	 */
	public Map<String, Object> fieldMap(Object record) {
		Object target = Types.indirect(record);
		Types.requireStruct(target);
		Map<String, Object> result = new LinkedHashMap<>();
		typeDescriptorFor(target.getClass()).fieldMap().forEach((path, fd) ->
			result.put(path, Accessors.fieldByTraversalReadOnly(target, fd.traversal()).get()));
		return Collections.unmodifiableMap(result);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Mapper.class);
}
