package org.janelia.saalfeldlab.label.stitching.subvolume;

import java.io.Serializable;
import java.util.Arrays;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.util.Intervals;

/**
 * Axis aligned box in global coordinates with inclusive {@code min} and {@code max}. Dimension 0 is x.
 */
public class Box implements Serializable {

	private static final long serialVersionUID = 6285173048823104455L;

	private final long[] min;

	private final long[] max;

	public Box(final long[] min, final long[] max) {

		if (min.length != max.length)
			throw new IllegalArgumentException("Dimensionality mismatch: " + Arrays.toString(min) + " " + Arrays.toString(max));
		this.min = min.clone();
		this.max = max.clone();
	}

	public static Box of(final Interval interval) {

		return new Box(Intervals.minAsLongArray(interval), Intervals.maxAsLongArray(interval));
	}

	public int numDimensions() {

		return min.length;
	}

	public long min(final int d) {

		return min[d];
	}

	public long max(final int d) {

		return max[d];
	}

	public long[] min() {

		return min.clone();
	}

	public long[] max() {

		return max.clone();
	}

	public Interval interval() {

		return new FinalInterval(min, max);
	}

	public Box expand(final long border) {

		final long[] expandedMin = new long[min.length];
		final long[] expandedMax = new long[max.length];
		Arrays.setAll(expandedMin, d -> min[d] - border);
		Arrays.setAll(expandedMax, d -> max[d] + border);
		return new Box(expandedMin, expandedMax);
	}

	/**
	 * @return {@code true} if the ranges of this and {@code other} along {@code d} are adjacent without overlap
	 */
	public boolean touches(final Box other, final int d) {

		return max[d] + 1 == other.min[d] || other.max[d] + 1 == min[d];
	}

	public boolean intersects(final Box other, final int d) {

		return min[d] <= other.max[d] && other.min[d] <= max[d];
	}

	/**
	 * @return {@code true} if both boxes share a face, i.e. they touch along exactly one axis and intersect along all others
	 */
	public boolean sharesFace(final Box other) {

		int touching = 0;
		for (int d = 0; d < min.length; ++d) {
			if (touches(other, d))
				++touching;
			else if (!intersects(other, d))
				return false;
		}
		return touching == 1;
	}

	@Override
	public boolean equals(final Object other) {

		return other instanceof Box && Arrays.equals(min, ((Box)other).min) && Arrays.equals(max, ((Box)other).max);
	}

	@Override
	public int hashCode() {

		return 31 * Arrays.hashCode(min) + Arrays.hashCode(max);
	}

	@Override
	public String toString() {

		return "(" + Arrays.toString(min) + " " + Arrays.toString(max) + ")";
	}
}
