package works.fieldmap;

import java.util.function.UnaryOperator;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Determines the logical name of each field.
 * <p>
 * A {@link works.fieldmap.annotations.Tag Tag} with the configured {@link #tagKey}
 * takes precedence; otherwise the {@link #nameMapper} is applied to the Java field name;
 * otherwise the field has an empty name, which still gives it a path but keeps it out of
 * {@link TypeDescriptor#fieldMap()}.
 */
@Value
@Builder(toBuilder = true)
public class NamingPolicy {
	public static final NamingPolicy DEFAULT = NamingPolicy.builder().build();

	/**
	 * The {@link works.fieldmap.annotations.Tag#key() key} of the tags to obey.
	 * Empty means tags are ignored.
	 */
	@Default @NonNull String tagKey = "";

	/**
	 * Maps a Java field name to a logical name for fields that have no tag.
	 */
	@Nullable UnaryOperator<String> nameMapper;

	/**
	 * Applied to the raw tag value, options and all, to produce
	 * {@link FieldDescriptor#mappedTag()}. Does not affect the field's name or path.
	 */
	@Nullable UnaryOperator<String> tagMapper;

	public boolean usesTags() {
		return !tagKey.isEmpty();
	}
}
