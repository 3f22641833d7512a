package works.fieldmap.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Container for repeated {@link Tag} annotations.
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface Tags {
	Tag[] value();
}
