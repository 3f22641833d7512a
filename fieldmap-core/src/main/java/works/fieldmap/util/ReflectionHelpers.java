package works.fieldmap.util;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.FieldVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.reflect.Modifier.isStatic;
import static org.objectweb.asm.ClassReader.SKIP_CODE;
import static org.objectweb.asm.ClassReader.SKIP_DEBUG;
import static org.objectweb.asm.ClassReader.SKIP_FRAMES;
import static org.objectweb.asm.Opcodes.ACC_STATIC;
import static org.objectweb.asm.Opcodes.ACC_SYNTHETIC;
import static org.objectweb.asm.Opcodes.ASM9;

public final class ReflectionHelpers {
	private ReflectionHelpers() { }

	/**
	 * {@link Class#getDeclaredFields()} makes no promise about ordering,
	 * so we read the order from the class file.
	 * <p>
	 * Static and synthetic fields are omitted, so the index of a field in the returned
	 * list is its <em>position</em> within the class. Inherited fields are not included.
	 * The returned fields have had {@link Field#trySetAccessible()} called on them.
	 *
	 * @return an unmodifiable list, the same object on every call for a given class
	 */
	public static List<Field> getInstanceFieldsInOrder(Class<?> type) {
		return INSTANCE_FIELDS.get(type);
	}

	private static final ClassValue<List<Field>> INSTANCE_FIELDS = new ClassValue<>() {
		@Override
		protected List<Field> computeValue(Class<?> type) {
			return computeInstanceFields(type);
		}
	};

	private static List<Field> computeInstanceFields(Class<?> type) {
		List<Field> result = fieldsFromClassFile(type);
		if (result == null) {
			LOGGER.debug("Using reflection order for fields of {}", type.getName());
			result = Stream.of(type.getDeclaredFields())
				.filter(f -> !isStatic(f.getModifiers()) && !f.isSynthetic())
				.toList();
		}
		for (Field f : result) {
			if (!f.trySetAccessible()) {
				LOGGER.debug("Field {} is not accessible", f);
			}
		}
		return List.copyOf(result);
	}

	@Nullable
	private static List<Field> fieldsFromClassFile(Class<?> type) {
		List<String> names = new ArrayList<>();
		try (InputStream in = type.getResourceAsStream("/" + type.getName().replace('.', '/') + ".class")) {
			if (in == null) {
				return null;
			}
			new ClassReader(in).accept(new ClassVisitor(ASM9) {
				@Override
				public FieldVisitor visitField(int access, String name, String descriptor, String signature, Object value) {
					if ((access & (ACC_STATIC | ACC_SYNTHETIC)) == 0) {
						names.add(name);
					}
					return null;
				}
			}, SKIP_CODE | SKIP_DEBUG | SKIP_FRAMES);
		} catch (IOException | IllegalArgumentException e) {
			// IllegalArgumentException is what ASM throws for a class file version it doesn't know
			LOGGER.debug("Unable to read class file for {}", type.getName(), e);
			return null;
		}

		List<Field> result = new ArrayList<>(names.size());
		for (String name : names) {
			try {
				result.add(type.getDeclaredField(name));
			} catch (NoSuchFieldException e) {
				// Class file on the classpath doesn't match the loaded class
				LOGGER.debug("Class file for {} declares unknown field {}", type.getName(), name);
				return null;
			}
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ReflectionHelpers.class);
}
