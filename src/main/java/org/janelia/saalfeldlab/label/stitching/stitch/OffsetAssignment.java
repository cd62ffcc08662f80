package org.janelia.saalfeldlab.label.stitching.stitch;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import gnu.trove.map.hash.TIntLongHashMap;
import scala.Tuple2;

/**
 * Offsets that make the label ranges of all subvolumes disjoint. Subvolumes are visited in ascending index
 * order, the first one gets offset 0 and each following one the sum of the max ids of all previous ones.
 */
public class OffsetAssignment implements Serializable {

	private static final long serialVersionUID = -2193402915538610762L;

	private final TIntLongHashMap offsets;

	private final long totalMaxId;

	private OffsetAssignment(final TIntLongHashMap offsets, final long totalMaxId) {

		this.offsets = offsets;
		this.totalMaxId = totalMaxId;
	}

	/**
	 * @param maxIds {@code (subvolume index, max id)} in any order
	 */
	public static OffsetAssignment fromMaxIds(final List<Tuple2<Integer, Long>> maxIds) {

		final List<Tuple2<Integer, Long>> sorted = new ArrayList<>(maxIds);
		sorted.sort((t1, t2) -> Integer.compare(t1._1(), t2._1()));

		final TIntLongHashMap offsets = new TIntLongHashMap();
		long offset = 0;
		for (final Tuple2<Integer, Long> indexAndMaxId : sorted) {
			if (offsets.containsKey(indexAndMaxId._1()))
				throw new IllegalArgumentException("Duplicate subvolume index " + indexAndMaxId._1());
			if (indexAndMaxId._2() < 0)
				throw new IllegalArgumentException("Max id for subvolume " + indexAndMaxId._1() + " not in [0, 2^63): " + Long.toUnsignedString(indexAndMaxId._2()));
			offsets.put(indexAndMaxId._1(), offset);
			try {
				offset = Math.addExact(offset, indexAndMaxId._2());
			} catch (final ArithmeticException e) {
				throw new IllegalArgumentException("Sum of max ids exceeds 2^63 - 1 at subvolume " + indexAndMaxId._1(), e);
			}
		}
		return new OffsetAssignment(offsets, offset);
	}

	public long offset(final int index) {

		if (!offsets.containsKey(index))
			throw new IllegalArgumentException("No offset for subvolume " + index);
		return offsets.get(index);
	}

	/**
	 * @return upper bound for all labels after offsets are applied
	 */
	public long totalMaxId() {

		return totalMaxId;
	}

	public int size() {

		return offsets.size();
	}
}
