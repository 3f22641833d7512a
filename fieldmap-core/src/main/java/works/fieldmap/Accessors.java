package works.fieldmap;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.fieldmap.exceptions.FieldAccessException;
import works.fieldmap.util.ReflectionHelpers;

import static java.lang.reflect.Modifier.isFinal;
import static java.util.Objects.requireNonNull;
import static works.fieldmap.TypeKind.MAP;
import static works.fieldmap.TypeKind.STRUCT;

/**
 * Navigates live objects along a {@link Traversal}.
 * <p>
 * Navigation starts at the runtime class of the root object (after {@link Types#indirect unwrapping}
 * an {@code Optional}) and then follows the declared type of each field along the way,
 * dereferencing {@code Optional} fields.
 */
public final class Accessors {
	private Accessors() { }

	/**
	 * Navigates to the field at {@code traversal}, making sure every object along the way exists,
	 * so that the result can be {@link FieldRef#set written}.
	 * <p>
	 * At each step, a {@code null} field is given a new empty instance
	 * if its declared type is a {@link TypeKind#MAP map} or a {@link TypeKind#STRUCT struct},
	 * and an empty {@code Optional} of such a type is given {@code Optional.of} a new instance.
	 * The last field is given one too when possible. If it is {@code final}, as the components
	 * of a Java record are, or no instance can be constructed, it is left as it is.
	 * <p>
	 * Nothing is modified unless the whole traversal can be completed.
	 *
	 * @throws FieldAccessException if an object along the way is missing and can't be supplied,
	 * such as a {@code null} component of a Java record; {@code root} is then unchanged
	 * @throws IllegalArgumentException if {@code traversal} doesn't fit the objects
	 */
	public static FieldRef fieldByTraversal(Object root, Traversal traversal) {
		Object current = requireNonNull(Types.indirect(root), "root");
		if (traversal.isEmpty()) {
			return FieldRef.root(current);
		}
		List<PendingWrite> writes = new ArrayList<>();
		Class<?> currentType = current.getClass();
		for (int i = 0; ; i++) {
			Field field = fieldAt(currentType, traversal, i);
			boolean last = (i == traversal.length() - 1);
			Object value = FieldRef.read(current, field);
			if (needsAllocation(field, value)) {
				Object allocated = isFinal(field.getModifiers()) ? null : allocationFor(field);
				if (allocated != null) {
					writes.add(new PendingWrite(current, field, allocated));
					value = allocated;
				} else if (last) {
					LOGGER.debug("Leaving {}.{} unallocated", field.getDeclaringClass().getSimpleName(), field.getName());
				} else {
					throw new FieldAccessException(field.getDeclaringClass(), field.getName(),
						"traversal " + traversal + " needs an object here, and none can be supplied");
				}
			}
			if (last) {
				// Innermost first. Only the outermost write touches an object the caller can already see.
				for (int w = writes.size() - 1; w >= 0; w--) {
					writes.get(w).apply();
				}
				return FieldRef.of(current, field);
			}
			current = Types.indirect(value);
			if (current == null) {
				throw new IllegalArgumentException("Traversal " + traversal + " passes through "
					+ field.getDeclaringClass().getSimpleName() + "." + field.getName()
					+ ", which holds no object");
			}
			currentType = Types.rawClass(Types.deref(field.getGenericType()));
		}
	}

	/**
	 * Like {@link #fieldByTraversal} but never modifies anything.
	 * If an object along the way is missing, the result is {@link FieldRef#detached detached}.
	 *
	 * @throws IllegalArgumentException if {@code traversal} doesn't fit the types
	 */
	public static FieldRef fieldByTraversalReadOnly(Object root, Traversal traversal) {
		Object current = requireNonNull(Types.indirect(root), "root");
		if (traversal.isEmpty()) {
			return FieldRef.root(current);
		}
		Class<?> currentType = current.getClass();
		for (int i = 0; ; i++) {
			Field field = fieldAt(currentType, traversal, i);
			if (i == traversal.length() - 1) {
				if (current == null) {
					return FieldRef.detached(field);
				} else {
					return FieldRef.of(current, field);
				}
			}
			if (current != null) {
				current = Types.indirect(FieldRef.read(current, field));
			}
			currentType = Types.rawClass(Types.deref(field.getGenericType()));
		}
	}

	private static Field fieldAt(Class<?> type, Traversal traversal, int step) {
		List<Field> fields = ReflectionHelpers.getInstanceFieldsInOrder(type);
		int position = traversal.get(step);
		if (position >= fields.size()) {
			throw new IllegalArgumentException("Traversal " + traversal
				+ " refers to field " + position + " of " + type.getName()
				+ ", which has " + fields.size());
		}
		return fields.get(position);
	}

	private static boolean needsAllocation(Field field, @Nullable Object value) {
		if (field.getType() == Optional.class) {
			return (value == null || ((Optional<?>) value).isEmpty())
				&& isAllocatable(Types.rawClass(Types.deref(field.getGenericType())));
		} else {
			return value == null && isAllocatable(field.getType());
		}
	}

	/**
	 * @return a new value for {@code field}, or {@code null} if none can be constructed
	 */
	@Nullable
	private static Object allocationFor(Field field) {
		if (field.getType() == Optional.class) {
			Object content = newInstance(Types.rawClass(Types.deref(field.getGenericType())));
			return (content == null) ? null : Optional.of(content);
		} else {
			return newInstance(field.getType());
		}
	}

	private static boolean isAllocatable(Class<?> type) {
		TypeKind kind = Types.kindOf(type);
		return kind == MAP || kind == STRUCT;
	}

	@Nullable
	private static Object newInstance(Class<?> type) {
		if (type.isAssignableFrom(LinkedHashMap.class)) {
			return new LinkedHashMap<>();
		} else if (type.isAssignableFrom(TreeMap.class)) {
			return new TreeMap<>();
		} else if (type.isAssignableFrom(ConcurrentHashMap.class)) {
			return new ConcurrentHashMap<>();
		}
		try {
			if (type.isRecord()) {
				RecordComponent[] components = type.getRecordComponents();
				Class<?>[] parameterTypes = Stream.of(components)
					.map(RecordComponent::getType)
					.toArray(Class<?>[]::new);
				Object[] zeros = Stream.of(parameterTypes)
					.map(Types::zeroValue)
					.toArray();
				return accessible(type.getDeclaredConstructor(parameterTypes)).newInstance(zeros);
			} else {
				return accessible(type.getDeclaredConstructor()).newInstance();
			}
		} catch (ReflectiveOperationException | IllegalArgumentException e) {
			LOGGER.debug("Unable to construct {}", type.getName(), e);
			return null;
		}
	}

	private static <T> Constructor<T> accessible(Constructor<T> constructor) {
		// If this fails, newInstance will say so
		constructor.trySetAccessible();
		return constructor;
	}

	private record PendingWrite(Object owner, Field field, Object value) {
		void apply() {
			FieldRef.write(owner, field, value);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Accessors.class);
}
