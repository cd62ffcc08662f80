package org.janelia.saalfeldlab.label.stitching.split;

import gnu.trove.map.hash.TLongLongHashMap;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.algorithm.util.unionfind.IntArrayUnionFind;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.integer.UnsignedLongType;
import net.imglib2.util.IntervalIndexer;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Connected components of a label image. Two voxels are connected if they are face neighbors and carry the same
 * non-zero label. Components are numbered {@code 1..K} in the order of their first voxel in flat iteration order.
 */
public class ConnectedComponentsOfLabels {

	private ConnectedComponentsOfLabels() {

	}

	public static <I extends IntegerType<I>> ArrayImg<UnsignedLongType, LongArray> label(final RandomAccessibleInterval<I> labels) {

		final RandomAccessibleInterval<I> zeroMin = Views.zeroMin(labels);
		final long[] dims = Intervals.dimensionsAsLongArray(zeroMin);
		final long numVoxels = Intervals.numElements(zeroMin);
		if (numVoxels > Integer.MAX_VALUE)
			throw new IllegalArgumentException("Currently only Integer.MAX_VALUE voxels supported, got " + numVoxels);

		final IntArrayUnionFind uf = new IntArrayUnionFind((int)numVoxels);
		final long[] position = new long[dims.length];
		long stride = 1;
		for (int d = 0; d < dims.length; stride *= dims[d], ++d) {
			if (dims[d] < 2)
				continue;
			final long[] min1 = new long[dims.length];
			final long[] max1 = new long[dims.length];
			for (int k = 0; k < dims.length; ++k)
				max1[k] = dims[k] - 1;
			final long[] min2 = min1.clone();
			final long[] max2 = max1.clone();
			max1[d] -= 1;
			min2[d] += 1;
			final Cursor<I> cursor1 = Views.flatIterable(Views.interval(zeroMin, min1, max1)).localizingCursor();
			final Cursor<I> cursor2 = Views.flatIterable(Views.interval(zeroMin, min2, max2)).cursor();
			while (cursor1.hasNext()) {
				final long label1 = cursor1.next().getIntegerLong();
				final long label2 = cursor2.next().getIntegerLong();
				if (label1 != 0 && label1 == label2) {
					cursor1.localize(position);
					final long index = IntervalIndexer.positionToIndex(position, dims);
					final long r1 = uf.findRoot(index);
					final long r2 = uf.findRoot(index + stride);
					if (r1 != r2)
						uf.join(r1, r2);
				}
			}
		}

		final ArrayImg<UnsignedLongType, LongArray> components = ArrayImgs.unsignedLongs(dims);
		final TLongLongHashMap componentOfRoot = new TLongLongHashMap();
		final Cursor<I> source = Views.flatIterable(zeroMin).cursor();
		final Cursor<UnsignedLongType> target = components.cursor();
		long nextComponent = 1;
		for (long index = 0; source.hasNext(); ++index) {
			final long label = source.next().getIntegerLong();
			final UnsignedLongType component = target.next();
			if (label == 0)
				continue;
			final long root = uf.findRoot(index);
			if (!componentOfRoot.containsKey(root))
				componentOfRoot.put(root, nextComponent++);
			component.set(componentOfRoot.get(root));
		}
		return components;
	}
}
