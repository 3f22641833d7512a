package works.fieldmap;

import java.util.LinkedHashMap;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import works.fieldmap.Fixtures.Address;
import works.fieldmap.Fixtures.Invoice;
import works.fieldmap.Fixtures.Money;
import works.fieldmap.Fixtures.Person;
import works.fieldmap.Fixtures.Profile;
import works.fieldmap.Fixtures.Route;
import works.fieldmap.Fixtures.Segment;
import works.fieldmap.Fixtures.Tally;
import works.fieldmap.exceptions.FieldAccessException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AccessorsTest {
	static final Traversal PERSON_CITY = Traversal.of(1, 0);

	@Test
	void mutable_allocatesMissingStruct() {
		Person person = new Person("Ann", null);
		FieldRef city = Accessors.fieldByTraversal(person, PERSON_CITY);
		assertNotNull(person.address);
		assertSame(person.address, city.owner());
		assertTrue(city.isPresent());

		city.set("Paris");
		assertEquals("Paris", person.address.city);
		assertEquals("Paris", city.get());
	}

	@Test
	void mutable_keepsExistingObjects() {
		Address address = new Address("Rome");
		Person person = new Person("Ann", address);
		FieldRef city = Accessors.fieldByTraversal(person, PERSON_CITY);
		assertSame(address, person.address);
		assertEquals("Rome", city.get());
	}

	@Test
	void mutable_allocatesAtLastStepToo() {
		Person person = new Person();
		FieldRef address = Accessors.fieldByTraversal(person, Traversal.of(1));
		assertInstanceOf(Address.class, address.get());
		assertNull(person.name, "Leaf fields are left alone");
	}

	@Test
	void mutable_initializesMap() {
		Profile profile = new Profile();
		FieldRef tags = Accessors.fieldByTraversal(profile, Traversal.of(1));
		assertInstanceOf(LinkedHashMap.class, profile.tags);
		assertTrue(profile.tags.isEmpty());
		assertSame(profile.tags, tags.get());
	}

	@Test
	void mutable_fillsEmptyOptional() {
		Profile profile = new Profile();
		profile.home = Optional.empty();
		Accessors.fieldByTraversal(profile, Traversal.of(0, 0)).set("Oslo");
		assertEquals("Oslo", profile.home.orElseThrow().city);
	}

	@Test
	void mutable_throughEmbeddedOptional() {
		Profile profile = new Profile();
		Accessors.fieldByTraversal(profile, Traversal.of(2, 0)).set(42);
		assertEquals(42, profile.base.orElseThrow().id);
	}

	@Test
	void mutable_recordComponentIsLeftAlone() {
		Route route = new Route();
		FieldRef from = Accessors.fieldByTraversal(route, Traversal.of(0, 0));
		assertEquals(new Segment(null, null), route.segment);
		assertNull(from.get());
		assertThrows(FieldAccessException.class, () -> from.set(new Address("Rome")));
	}

	@Test
	void mutable_unconstructibleLeafIsLeftAlone() {
		Invoice invoice = new Invoice();
		FieldRef total = Accessors.fieldByTraversal(invoice, Traversal.of(0));
		assertNull(total.get());
		assertNull(invoice.total);

		total.set(new Money(5));
		assertEquals(5, invoice.total.amount);
	}

	@Test
	void mutable_unreachablePathChangesNothing() {
		Route route = new Route();
		FieldAccessException e = assertThrows(FieldAccessException.class,
			() -> Accessors.fieldByTraversal(route, Traversal.of(0, 0, 0)));
		assertEquals(Segment.class, e.containingClass());
		assertEquals("from", e.fieldName());
		assertNull(route.segment);

		Invoice invoice = new Invoice();
		assertThrows(FieldAccessException.class, () -> Accessors.fieldByTraversal(invoice, Traversal.of(0, 0)));
		assertNull(invoice.total);
	}

	@Test
	void readOnly_doesNotAllocate() {
		Person person = new Person("Ann", null);
		FieldRef city = Accessors.fieldByTraversalReadOnly(person, PERSON_CITY);
		assertNull(person.address);
		assertFalse(city.isPresent());
		assertNull(city.get());
		assertThrows(FieldAccessException.class, () -> city.set("Paris"));
		assertNull(person.address);
	}

	@Test
	void readOnly_readsExistingValue() {
		Person person = new Person("Ann", new Address("Rome"));
		assertEquals("Rome", Accessors.fieldByTraversalReadOnly(person, PERSON_CITY).get());
	}

	@Test
	void readOnly_missingPrimitiveReadsAsZero() {
		Tally tally = new Tally();
		FieldRef count = Accessors.fieldByTraversalReadOnly(tally, Traversal.of(0, 0));
		assertEquals(0, count.get());
		assertEquals(int.class, count.type());
		assertNull(tally.counter);
	}

	@Test
	void readOnly_doesNotTouchMapsOrOptionals() {
		Profile profile = new Profile();
		assertNull(Accessors.fieldByTraversalReadOnly(profile, Traversal.of(1)).get());
		assertNull(Accessors.fieldByTraversalReadOnly(profile, Traversal.of(0, 0)).get());
		assertNull(profile.tags);
		assertNull(profile.home);
	}

	@Test
	void emptyTraversal_givesRoot() {
		Person person = new Person("Ann", null);
		FieldRef root = Accessors.fieldByTraversal(person, Traversal.EMPTY);
		assertTrue(root.isRoot());
		assertSame(person, root.get());
		assertThrows(IllegalStateException.class, () -> root.set(new Person()));
		assertSame(person, Accessors.fieldByTraversalReadOnly(person, Traversal.EMPTY).get());
	}

	@Test
	void optionalRoot_isUnwrapped() {
		Person person = new Person("Ann", null);
		assertEquals("Ann", Accessors.fieldByTraversal(Optional.of(person), Traversal.of(0)).get());
	}

	@Test
	void badPosition_throws() {
		Person person = new Person();
		assertThrows(IllegalArgumentException.class, () -> Accessors.fieldByTraversal(person, Traversal.of(5)));
		assertThrows(IllegalArgumentException.class, () -> Accessors.fieldByTraversalReadOnly(person, Traversal.of(1, 3)));
	}

	@Test
	void throughLeaf_throws() {
		Person person = new Person();
		assertThrows(IllegalArgumentException.class, () -> Accessors.fieldByTraversal(person, Traversal.of(0, 0)),
			"name is a String; there's nothing to allocate and nowhere to go");
	}
}
