package works.fieldmap;

/**
 * Coarse classification of Java types as seen by field discovery.
 * Only {@link #STRUCT} types have fields that are discovered and navigated.
 *
 * @see Types#kindOf(Class)
 */
public enum TypeKind {
	/**
	 * Not a type at all: the kind of a {@code null} or empty {@code Optional} value.
	 */
	NONE,
	PRIMITIVE,
	ARRAY,
	ENUM,
	OPTIONAL,
	MAP,
	COLLECTION,
	INTERFACE,

	/**
	 * A platform class such as {@code String}, {@code Integer} or {@code LocalDate},
	 * treated as an opaque value.
	 */
	SCALAR,

	/**
	 * Any other class, including Java records: a structured object whose fields can be mapped.
	 */
	STRUCT,
}
