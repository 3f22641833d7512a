package works.fieldmap.exceptions;

/**
 * A field couldn't be read or written reflectively, or an object it needs couldn't be supplied.
 */
public class FieldAccessException extends IllegalStateException {
	private final Class<?> containingClass;
	private final String fieldName;

	public Class<?> containingClass() {
		return this.containingClass;
	}

	public String fieldName() {
		return this.fieldName;
	}

	public FieldAccessException(Class<?> containingClass, String fieldName, String message) {
		super(fullMessage(containingClass, fieldName, message));
		this.containingClass = containingClass;
		this.fieldName = fieldName;
	}

	public FieldAccessException(Class<?> containingClass, String fieldName, String message, Throwable cause) {
		super(fullMessage(containingClass, fieldName, message), cause);
		this.containingClass = containingClass;
		this.fieldName = fieldName;
	}

	private static String fullMessage(Class<?> containingClass, String fieldName, String message) {
		return "Unable to access " + containingClass.getSimpleName() + "." + fieldName + ": " + message;
	}
}
