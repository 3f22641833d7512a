package works.fieldmap;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import works.fieldmap.exceptions.InvalidUsageException;

import static works.fieldmap.TypeKind.ARRAY;
import static works.fieldmap.TypeKind.COLLECTION;
import static works.fieldmap.TypeKind.ENUM;
import static works.fieldmap.TypeKind.INTERFACE;
import static works.fieldmap.TypeKind.MAP;
import static works.fieldmap.TypeKind.NONE;
import static works.fieldmap.TypeKind.OPTIONAL;
import static works.fieldmap.TypeKind.PRIMITIVE;
import static works.fieldmap.TypeKind.SCALAR;
import static works.fieldmap.TypeKind.STRUCT;

/**
 * Static helpers for reasoning about the declared types of fields.
 */
public final class Types {
	private Types() { }

	/**
	 * The type equivalent of {@link #indirect}: unwraps one level of {@link Optional}.
	 * A raw {@code Optional} dereferences to {@code Object}.
	 * Any other type is returned unchanged.
	 */
	public static Type deref(Type type) {
		if (rawClass(type) == Optional.class) {
			if (type instanceof ParameterizedType p) {
				return p.getActualTypeArguments()[0];
			} else {
				return Object.class;
			}
		}
		return type;
	}

	/**
	 * @return {@code value} itself, or the contents of {@code value} if it's an {@link Optional}
	 * ({@code null} if the optional is empty)
	 */
	@Nullable
	public static Object indirect(@Nullable Object value) {
		if (value instanceof Optional<?> o) {
			return o.orElse(null);
		} else {
			return value;
		}
	}

	public static Class<?> rawClass(Type type) {
		if (type instanceof Class<?> c) {
			return c;
		} else if (type instanceof ParameterizedType p) {
			return rawClass(p.getRawType());
		} else if (type instanceof GenericArrayType g) {
			return rawClass(g.getGenericComponentType()).arrayType();
		} else if (type instanceof TypeVariable<?> v) {
			return rawClass(v.getBounds()[0]);
		} else if (type instanceof WildcardType w) {
			return rawClass(w.getUpperBounds()[0]);
		} else {
			throw new IllegalArgumentException("Unexpected type: " + type);
		}
	}

	public static TypeKind kindOf(Class<?> c) {
		if (c.isPrimitive()) {
			return PRIMITIVE;
		} else if (c.isArray()) {
			return ARRAY;
		} else if (c.isEnum() || (c.getSuperclass() != null && c.getSuperclass().isEnum())) {
			// The second case is an enum constant with a body
			return ENUM;
		} else if (c == Optional.class) {
			return OPTIONAL;
		} else if (Map.class.isAssignableFrom(c)) {
			return MAP;
		} else if (Collection.class.isAssignableFrom(c)) {
			return COLLECTION;
		} else if (c.isInterface()) {
			return INTERFACE;
		} else if (isPlatformClass(c)) {
			return SCALAR;
		} else {
			return STRUCT;
		}
	}

	/**
	 * @return {@link TypeKind#NONE NONE} for {@code null}; otherwise the kind of the value's class
	 */
	public static TypeKind kindOf(@Nullable Object value) {
		if (value == null) {
			return NONE;
		} else {
			return kindOf(value.getClass());
		}
	}

	/**
	 * @return the value a field of the given type holds before anything is assigned to it
	 */
	@Nullable
	public static Object zeroValue(Class<?> c) {
		if (c.isPrimitive() && c != void.class) {
			return Array.get(Array.newInstance(c, 1), 0);
		} else {
			return null;
		}
	}

	/**
	 * @throws InvalidUsageException if {@code value} is not a {@link TypeKind#STRUCT STRUCT}
	 */
	public static void requireStruct(@Nullable Object value) {
		TypeKind kind = kindOf(value);
		if (kind != STRUCT) {
			throw new InvalidUsageException(callerName(), kind, value == null ? null : value.getClass());
		}
	}

	/**
	 * @throws InvalidUsageException if {@code type} is not a {@link TypeKind#STRUCT STRUCT}
	 */
	public static Class<?> requireStruct(Class<?> type) {
		TypeKind kind = kindOf(type);
		if (kind != STRUCT) {
			throw new InvalidUsageException(callerName(), kind, type);
		}
		return type;
	}

	private static boolean isPlatformClass(Class<?> c) {
		String name = c.getName();
		return name.startsWith("java.")
			|| name.startsWith("javax.")
			|| name.startsWith("jdk.")
			|| name.startsWith("sun.")
			|| name.startsWith("com.sun.");
	}

	/**
	 * @return the method that called the method that called this one
	 */
	private static String callerName() {
		return StackWalker.getInstance().walk(frames -> frames
			.skip(2)
			.findFirst()
			.map(f -> simpleName(f.getClassName()) + "." + f.getMethodName())
			.orElse("unknown method"));
	}

	private static String simpleName(String className) {
		return className.substring(className.lastIndexOf('.') + 1);
	}
}
