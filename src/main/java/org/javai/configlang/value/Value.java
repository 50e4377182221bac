package org.javai.configlang.value;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A parsed constant value. Sealed so every consumer handles both shapes.
 * <ul>
 *   <li>{@link IntegerValue} - an arbitrary-precision signed integer</li>
 *   <li>{@link ListValue} - an ordered, possibly nested sequence of values</li>
 * </ul>
 */
public sealed interface Value {

	/**
	 * @return array nesting depth; 0 for an integer, 1 for a list of integers
	 */
	int depth();

	/**
	 * @return number of values in this tree, counting shared elements once per occurrence
	 */
	long nodeCount();

	/**
	 * @param value the integer, never null
	 */
	record IntegerValue(BigInteger value) implements Value {
		public IntegerValue {
			if (value == null) {
				throw new IllegalArgumentException("Integer value cannot be null");
			}
		}

		@Override
		public int depth() {
			return 0;
		}

		@Override
		public long nodeCount() {
			return 1;
		}

		@Override
		public String toString() {
			return value.toString();
		}
	}

	/**
	 * An immutable list of values. Depth and node count are computed once from the
	 * elements, which already carry their own.
	 */
	final class ListValue implements Value {

		private final List<Value> elements;
		private final int depth;
		private final long nodeCount;

		public ListValue(List<Value> elements) {
			this.elements = elements != null ? List.copyOf(elements) : List.of();
			int deepest = 0;
			long count = 1;
			for (Value element : this.elements) {
				deepest = Math.max(deepest, element.depth());
				count = saturatedAdd(count, element.nodeCount());
			}
			this.depth = deepest + 1;
			this.nodeCount = count;
		}

		private static long saturatedAdd(long a, long b) {
			long sum = a + b;
			return sum < 0 ? Long.MAX_VALUE : sum;
		}

		public List<Value> elements() {
			return elements;
		}

		public int size() {
			return elements.size();
		}

		@Override
		public int depth() {
			return depth;
		}

		@Override
		public long nodeCount() {
			return nodeCount;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			return o instanceof ListValue other
					&& depth == other.depth
					&& nodeCount == other.nodeCount
					&& elements.equals(other.elements);
		}

		@Override
		public int hashCode() {
			return elements.hashCode();
		}

		@Override
		public String toString() {
			return elements.stream()
					.map(Value::toString)
					.collect(Collectors.joining(", ", "[", "]"));
		}
	}

	static Value of(long value) {
		return new IntegerValue(BigInteger.valueOf(value));
	}

	static Value of(BigInteger value) {
		return new IntegerValue(value);
	}

	static Value list(List<Value> elements) {
		return new ListValue(elements);
	}

	static Value list(Value... elements) {
		return new ListValue(List.of(elements));
	}
}
