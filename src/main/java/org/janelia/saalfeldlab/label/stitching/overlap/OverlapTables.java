package org.janelia.saalfeldlab.label.stitching.overlap;

import java.util.Arrays;

import org.janelia.saalfeldlab.label.stitching.exception.ShapeMismatchException;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

public class OverlapTables {

	/**
	 * Dense tables with more entries than this are rejected.
	 */
	public static final long MAX_DENSE_ENTRIES = 1L << 26;

	private OverlapTables() {

	}

	public static <A extends IntegerType<A>, B extends IntegerType<B>> OverlapTable build(
			final RandomAccessibleInterval<A> labelsA,
			final RandomAccessibleInterval<B> labelsB) {

		return build(labelsA, labelsB, true);
	}

	/**
	 * Count co-occurring labels of {@code labelsA} and {@code labelsB} in flat iteration order.
	 *
	 * @throws ShapeMismatchException if the volumes do not have the same dimensions
	 */
	public static <A extends IntegerType<A>, B extends IntegerType<B>> OverlapTable build(
			final RandomAccessibleInterval<A> labelsA,
			final RandomAccessibleInterval<B> labelsB,
			final boolean sparse) {

		final long[] dimensionsA = Intervals.dimensionsAsLongArray(labelsA);
		final long[] dimensionsB = Intervals.dimensionsAsLongArray(labelsB);
		if (!Arrays.equals(dimensionsA, dimensionsB))
			throw new ShapeMismatchException(dimensionsA, dimensionsB);

		final Cursor<A> cursorA = Views.flatIterable(labelsA).cursor();
		final Cursor<B> cursorB = Views.flatIterable(labelsB).cursor();

		if (sparse) {
			final SparseOverlapTable table = new SparseOverlapTable();
			while (cursorA.hasNext())
				table.add(cursorA.next().getIntegerLong(), cursorB.next().getIntegerLong());
			return table;
		}

		final long maxA = max(labelsA);
		final long maxB = max(labelsB);
		if (maxA < 0 || maxB < 0)
			throw new IllegalArgumentException(String.format(
					"Labels outside of [0, 2^63) not supported by dense overlap table: max labels %s and %s",
					Long.toUnsignedString(maxA),
					Long.toUnsignedString(maxB)));
		if (maxA >= MAX_DENSE_ENTRIES || maxB >= MAX_DENSE_ENTRIES || maxA + 1 > MAX_DENSE_ENTRIES / (maxB + 1))
			throw new IllegalArgumentException(String.format(
					"Label range too large for dense overlap table: %d x %d entries",
					maxA + 1,
					maxB + 1));
		final long numRows = maxA + 1;
		final long numCols = maxB + 1;

		final DenseOverlapTable table = new DenseOverlapTable((int)numRows, (int)numCols);
		while (cursorA.hasNext())
			table.add(cursorA.next().getIntegerLong(), cursorB.next().getIntegerLong());
		return table;
	}

	/**
	 * Maximum label in unsigned order. Negative labels of signed types compare above all non-negative ones.
	 */
	private static <I extends IntegerType<I>> long max(final RandomAccessibleInterval<I> labels) {

		long max = 0;
		for (final I label : Views.flatIterable(labels)) {
			final long l = label.getIntegerLong();
			if (Long.compareUnsigned(l, max) > 0)
				max = l;
		}
		return max;
	}
}
