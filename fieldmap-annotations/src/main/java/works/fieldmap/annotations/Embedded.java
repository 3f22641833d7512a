package works.fieldmap.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * On a field whose type is itself a structured object (possibly wrapped in an {@code Optional}),
 * promotes that object's fields into the namespace of the enclosing class.
 *
 * <p>
 * Without a {@link Tag} for the active key, embedding is transparent:
 *
 * <pre>
 *     public class Base {
 *         &#64;Tag(key = "db", value = "id") public int id;
 *     }
 *
 *     public class Derived {
 *         &#64;Embedded public Base base;
 *         &#64;Tag(key = "db", value = "extra") public String extra;
 *     }
 * </pre>
 *
 * Here {@code Derived} has the logical names {@code id} and {@code extra}.
 * If {@code base} were tagged {@code "b"}, they would be {@code b.id} and {@code extra}.
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface Embedded {
}
