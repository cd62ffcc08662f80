package org.janelia.saalfeldlab.label.stitching.split;

import java.util.Arrays;

import org.janelia.saalfeldlab.label.stitching.mapping.TotalMapping;

import gnu.trove.set.hash.TLongHashSet;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.integer.UnsignedLongType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Labels renumbered to {@code 1..N} in ascending order of the original labels. Background stays 0.
 */
public class ConsecutiveLabels {

	private final ArrayImg<UnsignedLongType, LongArray> labels;

	private final TotalMapping originalToConsecutive;

	private final long maxOriginalLabel;

	private ConsecutiveLabels(
			final ArrayImg<UnsignedLongType, LongArray> labels,
			final TotalMapping originalToConsecutive,
			final long maxOriginalLabel) {

		this.labels = labels;
		this.originalToConsecutive = originalToConsecutive;
		this.maxOriginalLabel = maxOriginalLabel;
	}

	public static <I extends IntegerType<I>> ConsecutiveLabels relabel(final RandomAccessibleInterval<I> labels) {

		final TLongHashSet unique = new TLongHashSet();
		for (final I label : Views.flatIterable(labels))
			unique.add(label.getIntegerLong());
		unique.remove(0);

		// unsigned order: flip the sign bit, sort, flip back
		final long[] sorted = unique.toArray();
		for (int i = 0; i < sorted.length; ++i)
			sorted[i] ^= Long.MIN_VALUE;
		Arrays.sort(sorted);
		for (int i = 0; i < sorted.length; ++i)
			sorted[i] ^= Long.MIN_VALUE;

		final TotalMapping.Builder builder = new TotalMapping.Builder().put(0, 0);
		for (int i = 0; i < sorted.length; ++i)
			builder.put(sorted[i], i + 1);
		final TotalMapping originalToConsecutive = builder.build();

		final ArrayImg<UnsignedLongType, LongArray> consecutive = ArrayImgs.unsignedLongs(Intervals.dimensionsAsLongArray(labels));
		final Cursor<I> source = Views.flatIterable(labels).cursor();
		final Cursor<UnsignedLongType> target = consecutive.cursor();
		while (source.hasNext())
			target.next().set(originalToConsecutive.apply(source.next().getIntegerLong()));

		return new ConsecutiveLabels(consecutive, originalToConsecutive, sorted.length == 0 ? 0 : sorted[sorted.length - 1]);
	}

	public ArrayImg<UnsignedLongType, LongArray> labels() {

		return labels;
	}

	/**
	 * @return mapping that includes {@code 0 -> 0}
	 */
	public TotalMapping originalToConsecutive() {

		return originalToConsecutive;
	}

	public long numLabels() {

		return originalToConsecutive.size() - 1;
	}

	public long maxOriginalLabel() {

		return maxOriginalLabel;
	}
}
