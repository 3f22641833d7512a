package works.fieldmap.util;

import java.lang.reflect.Field;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReflectionHelpersTest {

	@Test
	void getInstanceFieldsInOrder_correctOrder() {
		@SuppressWarnings("unused")
		class ClassWithSomeFields {
			String zebra;
			int apple;
			private long mango;
			public Object banana;
		}

		assertEquals(
			List.of("zebra", "apple", "mango", "banana"),
			names(ReflectionHelpers.getInstanceFieldsInOrder(ClassWithSomeFields.class)));
	}

	@Test
	void getInstanceFieldsInOrder_omitsStaticAndSynthetic() {
		assertEquals(
			List.of("second", "first"),
			names(ReflectionHelpers.getInstanceFieldsInOrder(InnerWithStatic.class)),
			"Neither the static field nor the reference to the enclosing instance counts");
	}

	@Test
	void getInstanceFieldsInOrder_ignoresInheritedFields() {
		@SuppressWarnings("unused")
		class Parent {
			String parentField;
		}
		@SuppressWarnings("unused")
		class Child extends Parent {
			String childField;
		}

		assertEquals(List.of("childField"), names(ReflectionHelpers.getInstanceFieldsInOrder(Child.class)));
	}

	@Test
	void getInstanceFieldsInOrder_recordComponents() {
		record Pair(String left, String right) { }
		assertEquals(List.of("left", "right"), names(ReflectionHelpers.getInstanceFieldsInOrder(Pair.class)));
	}

	@Test
	void getInstanceFieldsInOrder_isCachedAndAccessible() {
		List<Field> first = ReflectionHelpers.getInstanceFieldsInOrder(InnerWithStatic.class);
		assertSame(first, ReflectionHelpers.getInstanceFieldsInOrder(InnerWithStatic.class));
		for (Field f : first) {
			assertTrue(f.canAccess(new InnerWithStatic()), f.getName());
		}
	}

	@SuppressWarnings("unused")
	class InnerWithStatic {
		static final String IGNORED = "ignored";
		private String second;
		private int first;
	}

	private static List<String> names(List<Field> fields) {
		return fields.stream().map(Field::getName).toList();
	}
}
