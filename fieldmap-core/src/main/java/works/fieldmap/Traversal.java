package works.fieldmap;

import java.util.Arrays;

/**
 * The sequence of field positions leading from a root object down to a particular field.
 * <p>
 * Each element is an index into {@link works.fieldmap.util.ReflectionHelpers#getInstanceFieldsInOrder
 * the instance fields} of the class reached so far.
 * Immutable.
 */
public final class Traversal {
	private final int[] positions;

	public static final Traversal EMPTY = new Traversal(new int[0]);

	private Traversal(int[] positions) {
		this.positions = positions;
	}

	public static Traversal of(int... positions) {
		if (positions.length == 0) {
			return EMPTY;
		}
		for (int p : positions) {
			if (p < 0) {
				throw new IllegalArgumentException("Field position can't be negative: " + Arrays.toString(positions));
			}
		}
		return new Traversal(positions.clone());
	}

	/**
	 * @return a new traversal that continues from this one to the field at {@code position}.
	 * Shares no storage with {@code this}.
	 */
	public Traversal then(int position) {
		if (position < 0) {
			throw new IllegalArgumentException("Field position can't be negative: " + position);
		}
		int[] extended = Arrays.copyOf(positions, positions.length + 1);
		extended[positions.length] = position;
		return new Traversal(extended);
	}

	public int length() {
		return positions.length;
	}

	public int get(int index) {
		return positions[index];
	}

	public boolean isEmpty() {
		return positions.length == 0;
	}

	public int[] toArray() {
		return positions.clone();
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Traversal that = (Traversal) o;
		return Arrays.equals(positions, that.positions);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(positions);
	}

	@Override
	public String toString() {
		return Arrays.toString(positions);
	}
}
