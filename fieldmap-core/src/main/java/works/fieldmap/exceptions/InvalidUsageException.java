package works.fieldmap.exceptions;

import org.jetbrains.annotations.Nullable;
import works.fieldmap.TypeKind;

/**
 * An operation that requires a structured object was handed something else.
 * <p>
 * This indicates a programming error in the caller, not a condition to recover from.
 */
public class InvalidUsageException extends IllegalArgumentException {
	private final String operation;
	private final TypeKind kind;

	public String operation() {
		return this.operation;
	}

	public TypeKind kind() {
		return this.kind;
	}

	public InvalidUsageException(String operation, TypeKind kind, @Nullable Class<?> type) {
		super(fullMessage(operation, kind, type));
		this.operation = operation;
		this.kind = kind;
	}

	private static String fullMessage(String operation, TypeKind kind, @Nullable Class<?> type) {
		String description = (type == null) ? kind.toString() : kind + " " + type.getName();
		return "Call of " + operation + " on " + description + "; expected " + TypeKind.STRUCT;
	}
}
