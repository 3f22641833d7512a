package works.fieldmap.annotations;

import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Declares the logical name of a field under a given {@link #key key}.
 * <p>
 * The key identifies the naming scheme (for example {@code "json"} or {@code "db"}),
 * so one field can carry different names for different consumers:
 *
 * <pre>
 *     public class Person {
 *         &#64;Tag(key = "db", value = "user_name")
 *         &#64;Tag(key = "json", value = "userName,omitempty")
 *         public String userName;
 *     }
 * </pre>
 *
 * The {@link #value value} is a name optionally followed by comma-separated options,
 * each either {@code key} or {@code key=value}.
 * A name of {@code "-"} excludes the field.
 */
@Retention(RUNTIME)
@Target(FIELD)
@Repeatable(Tags.class)
public @interface Tag {
	String key();
	String value();
}
