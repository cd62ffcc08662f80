package org.janelia.saalfeldlab.label.stitching;

import java.io.Serializable;
import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.integer.UnsignedLongType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Dense block of labels placed at {@code min} in global coordinates. Labels are stored in flat iteration
 * order (dimension 0 fastest). This is the unit that is shipped between Spark tasks.
 */
public class LabelBlock implements Serializable {

	private static final long serialVersionUID = -1638472904875309123L;

	private final long[] min;

	private final long[] dimensions;

	private final long[] data;

	public LabelBlock(final long[] min, final long[] dimensions, final long[] data) {

		if (min.length != dimensions.length)
			throw new IllegalArgumentException("Dimensionality mismatch: " + Arrays.toString(min) + " " + Arrays.toString(dimensions));
		if (numElements(dimensions) != data.length)
			throw new IllegalArgumentException("Expected " + numElements(dimensions) + " labels but got " + data.length);
		this.min = min.clone();
		this.dimensions = dimensions.clone();
		this.data = data;
	}

	public static <I extends IntegerType<I>> LabelBlock copyOf(final RandomAccessibleInterval<I> source) {

		final long[] dimensions = Intervals.dimensionsAsLongArray(source);
		final long[] data = new long[(int)numElements(dimensions)];
		final Cursor<I> cursor = Views.flatIterable(source).cursor();
		for (int i = 0; cursor.hasNext(); ++i)
			data[i] = cursor.next().getIntegerLong();
		return new LabelBlock(Intervals.minAsLongArray(source), dimensions, data);
	}

	public static LabelBlock empty(final long[] min, final long[] dimensions) {

		final long[] emptyDimensions = dimensions.clone();
		Arrays.setAll(emptyDimensions, d -> Math.max(emptyDimensions[d], 0));
		return new LabelBlock(min, emptyDimensions, new long[(int)numElements(emptyDimensions)]);
	}

	public long[] min() {

		return min.clone();
	}

	public long[] dimensions() {

		return dimensions.clone();
	}

	/**
	 * @return the backing array, not a copy
	 */
	public long[] data() {

		return data;
	}

	public int numDimensions() {

		return dimensions.length;
	}

	public long numElements() {

		return data.length;
	}

	public boolean isEmpty() {

		return data.length == 0;
	}

	public Interval interval() {

		final long[] max = new long[min.length];
		Arrays.setAll(max, d -> min[d] + dimensions[d] - 1);
		return new FinalInterval(min, max);
	}

	public ArrayImg<UnsignedLongType, LongArray> img() {

		return ArrayImgs.unsignedLongs(data, dimensions);
	}

	/**
	 * @return view of the labels in global coordinates
	 */
	public RandomAccessibleInterval<UnsignedLongType> view() {

		return Views.translate(img(), min);
	}

	/**
	 * Copy the labels inside {@code interval}, which must be contained in this block.
	 */
	public LabelBlock crop(final Interval interval) {

		final long[] dimensions = Intervals.dimensionsAsLongArray(interval);
		if (Arrays.stream(dimensions).anyMatch(d -> d <= 0))
			return empty(Intervals.minAsLongArray(interval), dimensions);
		if (!Intervals.contains(interval(), interval))
			throw new IllegalArgumentException("Crop " + Arrays.toString(Intervals.minAsLongArray(interval)) + " "
					+ Arrays.toString(Intervals.maxAsLongArray(interval)) + " not contained in block " + this);
		return copyOf(Views.interval(view(), interval));
	}

	public LabelBlock withData(final long[] data) {

		return new LabelBlock(min, dimensions, data);
	}

	/**
	 * Labels are unsigned 64 bit integers, the maximum is taken in unsigned order.
	 */
	public long maxLabel() {

		long max = 0;
		for (final long label : data)
			if (Long.compareUnsigned(label, max) > 0)
				max = label;
		return max;
	}

	@Override
	public String toString() {

		return String.format("LabelBlock(min=%s dimensions=%s)", Arrays.toString(min), Arrays.toString(dimensions));
	}

	private static long numElements(final long[] dimensions) {

		long n = 1;
		for (final long d : dimensions)
			n *= d;
		return n;
	}
}
