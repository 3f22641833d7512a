package works.fieldmap;

import java.lang.reflect.Field;
import java.lang.reflect.Type;
import org.jetbrains.annotations.Nullable;
import works.fieldmap.exceptions.FieldAccessException;

import static java.util.Objects.requireNonNull;

/**
 * A live handle on one field of one object, as returned by {@link Accessors}.
 * <p>
 * There are three flavours:
 * <ul>
 *     <li>
 *         an ordinary ref, which reads and writes {@link #field()} of {@link #owner()};
 *     </li>
 *     <li>
 *         a <em>root</em> ref, from an empty {@link Traversal}, which has no field
 *         and whose value is the root object itself; and
 *     </li>
 *     <li>
 *         a <em>detached</em> ref, from a read-only traversal that ran into a missing object,
 *         which has no owner and reads as the field's {@link Types#zeroValue zero value}.
 *     </li>
 * </ul>
 * Root and detached refs can't be {@link #set}.
 */
public final class FieldRef {
	@Nullable private final Object owner;
	@Nullable private final Field field;

	private FieldRef(@Nullable Object owner, @Nullable Field field) {
		this.owner = owner;
		this.field = field;
	}

	public static FieldRef of(Object owner, Field field) {
		return new FieldRef(requireNonNull(owner), requireNonNull(field));
	}

	public static FieldRef root(Object value) {
		return new FieldRef(requireNonNull(value), null);
	}

	public static FieldRef detached(Field field) {
		return new FieldRef(null, requireNonNull(field));
	}

	/**
	 * @return the object holding the field; for a root ref, the root object itself;
	 * for a detached ref, {@code null}
	 */
	@Nullable
	public Object owner() {
		return owner;
	}

	/**
	 * @return the field, or {@code null} for a root ref
	 */
	@Nullable
	public Field field() {
		return field;
	}

	public boolean isRoot() {
		return field == null;
	}

	/**
	 * @return false if this is a detached ref
	 */
	public boolean isPresent() {
		return owner != null;
	}

	public Class<?> type() {
		if (field == null) {
			return requireNonNull(owner).getClass();
		} else {
			return field.getType();
		}
	}

	public Type genericType() {
		if (field == null) {
			return requireNonNull(owner).getClass();
		} else {
			return field.getGenericType();
		}
	}

	@Nullable
	public Object get() {
		if (field == null) {
			return owner;
		} else if (owner == null) {
			return Types.zeroValue(field.getType());
		} else {
			return read(owner, field);
		}
	}

	public void set(@Nullable Object value) {
		if (field == null) {
			throw new IllegalStateException("Can't set the root object");
		} else if (owner == null) {
			throw new FieldAccessException(field.getDeclaringClass(), field.getName(), "no object to write to");
		} else {
			write(owner, field, value);
		}
	}

	@Nullable
	static Object read(Object owner, Field field) {
		try {
			return field.get(owner);
		} catch (IllegalAccessException e) {
			throw new FieldAccessException(field.getDeclaringClass(), field.getName(), "not readable", e);
		}
	}

	static void write(Object owner, Field field, @Nullable Object value) {
		try {
			field.set(owner, value);
		} catch (IllegalAccessException e) {
			throw new FieldAccessException(field.getDeclaringClass(), field.getName(), "not writable", e);
		} catch (IllegalArgumentException e) {
			throw new FieldAccessException(field.getDeclaringClass(), field.getName(), "can't hold " + value, e);
		}
	}

	@Override
	public String toString() {
		if (field == null) {
			return "FieldRef(root " + type().getSimpleName() + ")";
		} else {
			return "FieldRef(" + field.getDeclaringClass().getSimpleName() + "." + field.getName()
				+ (owner == null ? " detached" : "")
				+ ")";
		}
	}
}
