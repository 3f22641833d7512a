package works.fieldmap;

import java.util.Map;
import java.util.Optional;
import works.fieldmap.annotations.Embedded;
import works.fieldmap.annotations.Tag;

/**
 * Classes to scan. Most are tagged under the key {@link #DB}.
 */
public final class Fixtures {
	private Fixtures() { }

	public static final String DB = "db";

	public static class Person {
		@Tag(key = DB, value = "name") public String name;
		@Tag(key = DB, value = "addr,omitempty") public Address address;

		public Person() { }

		public Person(String name, Address address) {
			this.name = name;
			this.address = address;
		}
	}

	public static class Address {
		@Tag(key = DB, value = "city") public String city;

		public Address() { }

		public Address(String city) {
			this.city = city;
		}
	}

	public static class Base {
		@Tag(key = DB, value = "id") public int id;
	}

	public static class Derived {
		@Embedded public Base base;
		@Tag(key = DB, value = "extra") public String extra;
	}

	public static class TaggedDerived {
		@Embedded @Tag(key = DB, value = "b") public Base base;
		@Tag(key = DB, value = "extra") public String extra;
	}

	public static class Account {
		public String userName;
		@Tag(key = DB, value = "acct_no") public String accountNumber;
	}

	@SuppressWarnings("unused")
	public static class WithExclusions {
		@Tag(key = DB, value = "-") public Address hidden;
		@Tag(key = DB, value = "kept") public String kept;
		@Tag(key = DB, value = "notPublic") String packagePrivate;
		@Tag(key = DB, value = "secret") private String secret;
		@Tag(key = DB, value = "constant") public static String CONSTANT = "constant";
		@Tag(key = DB, value = "-,omitempty") public String alsoHidden;
	}

	public static class Inner {
		@Tag(key = DB, value = "id") public String id;
		@Tag(key = DB, value = "innerOnly") public String innerOnly;
	}

	/**
	 * The embedded object comes first in declaration order, yet {@code id} is still found outside it first.
	 */
	public static class Outer {
		@Embedded public Inner inner;
		@Tag(key = DB, value = "id") public String id;
	}

	public static class Audit {
		@Tag(key = DB, value = "by") public String by;
	}

	public static class Meta {
		@Embedded public Audit audit;
		@Tag(key = DB, value = "version") public int version;
	}

	public static class Doc {
		@Tag(key = DB, value = "meta") public Meta meta;
	}

	public static class Profile {
		@Tag(key = DB, value = "home") public Optional<Address> home;
		@Tag(key = DB, value = "tags") public Map<String, String> tags;
		@Embedded public Optional<Base> base;
	}

	public static class Node {
		@Tag(key = DB, value = "value") public String value;
		@Tag(key = DB, value = "next") public Node next;
	}

	public static class Ping {
		@Tag(key = DB, value = "pong") public Pong pong;
	}

	public static class Pong {
		@Tag(key = DB, value = "ping") public Ping ping;
	}

	public record Point(
		@Tag(key = DB, value = "x") int x,
		@Tag(key = DB, value = "y") int y
	) { }

	public record Segment(
		@Tag(key = DB, value = "from") Address from,
		@Tag(key = DB, value = "to") Address to
	) { }

	public static class Route {
		@Tag(key = DB, value = "segment") public Segment segment;
	}

	public static class Money {
		@Tag(key = DB, value = "amount") public long amount;

		public Money(long amount) {
			this.amount = amount;
		}
	}

	public static class Invoice {
		@Tag(key = DB, value = "total") public Money total;
	}

	public static class Counter {
		@Tag(key = DB, value = "count") public int count;
	}

	public static class Tally {
		@Tag(key = DB, value = "counter") public Counter counter;
	}

	public static class MultiTagged {
		@Tag(key = DB, value = "full_name")
		@Tag(key = "json", value = "fullName,omitempty")
		public String fullName;

		public String untagged;
	}

	public static class BadEmbedding {
		@Embedded public String text;
	}
}
