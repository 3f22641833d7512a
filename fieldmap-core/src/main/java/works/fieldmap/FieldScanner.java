package works.fieldmap;

import java.lang.reflect.Field;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.fieldmap.annotations.Embedded;
import works.fieldmap.annotations.Tag;
import works.fieldmap.util.ReflectionHelpers;

import static java.lang.reflect.Modifier.isPublic;
import static java.util.Objects.requireNonNull;
import static works.fieldmap.TypeKind.STRUCT;

/**
 * Reflectively walks a class to build its {@link TypeDescriptor}.
 * <p>
 * The walk is breadth-first. Fields of the class itself come first,
 * then the fields of each {@link Embedded embedded} object and of each
 * field whose declared type is a {@link TypeKind#STRUCT STRUCT},
 * then the fields one level deeper, and so on.
 * Fields declared as {@code Optional<T>} are addressable but not walked,
 * unless they are {@link Embedded}.
 * <p>
 * Names are determined by the {@link NamingPolicy}.
 * A field named {@code "-"} is skipped along with everything beneath it,
 * as is any field that is neither {@code public} nor a record component.
 * <p>
 * A class is not walked again beneath itself, so self-referential classes terminate;
 * the field that would recurse is still included.
 * <p>
 * Stateless apart from its {@link NamingPolicy}; {@link Mapper} does the caching.
 */
public class FieldScanner {
	private final NamingPolicy policy;

	public FieldScanner(NamingPolicy policy) {
		this.policy = requireNonNull(policy);
	}

	public NamingPolicy policy() {
		return policy;
	}

	/**
	 * @param type a {@link TypeKind#STRUCT STRUCT} class, or an {@code Optional} of one
	 * @throws works.fieldmap.exceptions.InvalidUsageException if {@code type} is not a struct
	 */
	public TypeDescriptor scan(Type type) {
		Class<?> root = Types.requireStruct(Types.rawClass(Types.deref(type)));
		LOGGER.debug("Scanning {}", root.getName());

		List<FieldDescriptor> result = new ArrayList<>();
		Deque<Pending> queue = new ArrayDeque<>();
		queue.addLast(new Pending(root, Traversal.EMPTY, "", Set.of(root)));

		while (!queue.isEmpty()) {
			Pending pending = queue.removeFirst();
			List<Field> fields = ReflectionHelpers.getInstanceFieldsInOrder(pending.type());
			for (int position = 0; position < fields.size(); position++) {
				Field field = fields.get(position);
				Tag tag = tagFor(field);

				String rawName;
				if (tag != null) {
					rawName = tag.value();
				} else if (policy.nameMapper() != null) {
					rawName = policy.nameMapper().apply(field.getName());
				} else {
					rawName = "";
				}

				Map<String, String> options = new LinkedHashMap<>();
				String name = parseName(rawName, options);
				String mappedTag = mapTag(tag);

				String path;
				if (pending.parentPath().isEmpty()) {
					path = name;
				} else {
					path = pending.parentPath() + "." + name;
				}

				if ("-".equals(name)) {
					LOGGER.trace("Skipping {}: excluded by name", field);
					continue;
				}
				if (!isVisible(field)) {
					LOGGER.trace("Skipping {}: not visible", field);
					continue;
				}

				Traversal traversal = pending.owner().then(position);
				Type fieldType = field.getGenericType();
				Class<?> fieldClass = field.getType();
				boolean embedded = field.isAnnotationPresent(Embedded.class);
				if (embedded) {
					Class<?> embeddedClass = Types.requireStruct(Types.rawClass(Types.deref(fieldType)));
					// Untagged embedding is transparent: its fields share our parent's namespace
					String childParentPath = (tag != null) ? path : pending.parentPath();
					enqueue(queue, pending, embeddedClass, traversal, childParentPath);
				} else if (Types.kindOf(fieldClass) == STRUCT) {
					enqueue(queue, pending, fieldClass, traversal, path);
				}

				result.add(new FieldDescriptor(
					traversal,
					path,
					name,
					field,
					fieldType,
					Types.zeroValue(fieldClass),
					options,
					embedded,
					mappedTag
				));
			}
		}

		LOGGER.debug("Scanned {}: {} fields", root.getName(), result.size());
		return new TypeDescriptor(root, result);
	}

	@Nullable
	private Tag tagFor(Field field) {
		if (!policy.usesTags()) {
			return null;
		}
		for (Tag tag : field.getAnnotationsByType(Tag.class)) {
			if (tag.key().equals(policy.tagKey())) {
				return tag;
			}
		}
		return null;
	}

	@Nullable
	private String mapTag(@Nullable Tag tag) {
		if (tag == null) {
			return null;
		}
		UnaryOperator<String> tagMapper = policy.tagMapper();
		if (tagMapper == null) {
			return tag.value();
		} else {
			return tagMapper.apply(tag.value());
		}
	}

	/**
	 * Splits {@code "name,opt1,opt2=value"} into the name, which is returned,
	 * and the options, which are added to {@code options}.
	 */
	static String parseName(String rawName, Map<String, String> options) {
		String[] parts = rawName.split(",", -1);
		for (int i = 1; i < parts.length; i++) {
			// Anything after a second '=' is dropped
			String[] kv = parts[i].split("=", -1);
			options.put(kv[0], (kv.length > 1) ? kv[1] : "");
		}
		return parts[0];
	}

	private static boolean isVisible(Field field) {
		return isPublic(field.getModifiers()) || field.getDeclaringClass().isRecord();
	}

	private static void enqueue(Deque<Pending> queue, Pending parent, Class<?> type, Traversal owner, String parentPath) {
		if (parent.ancestors().contains(type)) {
			LOGGER.debug("Not walking {} at {} again beneath itself", type.getName(), owner);
			return;
		}
		Set<Class<?>> ancestors = new HashSet<>(parent.ancestors());
		ancestors.add(type);
		queue.addLast(new Pending(type, owner, parentPath, Set.copyOf(ancestors)));
	}

	/**
	 * A class whose fields are yet to be scanned.
	 *
	 * @param owner the traversal to the field that holds the object of this type
	 * @param parentPath prefix for the paths of this type's fields; empty for none
	 * @param ancestors the classes walked on the way here, including {@code type}
	 */
	private record Pending(
		Class<?> type,
		Traversal owner,
		String parentPath,
		Set<Class<?>> ancestors
	) { }

	private static final Logger LOGGER = LoggerFactory.getLogger(FieldScanner.class);
}
