package org.janelia.saalfeldlab.label.stitching.stitch;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.spark.api.java.function.PairFlatMapFunction;
import org.janelia.saalfeldlab.label.stitching.LabelBlock;
import org.janelia.saalfeldlab.label.stitching.subvolume.Box;
import org.janelia.saalfeldlab.label.stitching.subvolume.Subvolume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.FinalInterval;
import scala.Tuple2;

/**
 * For each neighbor of a subvolume, crop the region where the bordered boxes of both subvolumes overlap and
 * emit it under the key {@code (lower index, higher index)}. Both sides of a boundary emit crops of equal shape.
 */
public class BoundaryExtraction implements PairFlatMapFunction<LabeledSubvolume, Tuple2<Integer, Integer>, Tuple2<Subvolume, LabelBlock>> {

	private static final long serialVersionUID = -3702954165728318452L;

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	@Override
	public Iterator<Tuple2<Tuple2<Integer, Integer>, Tuple2<Subvolume, LabelBlock>>> call(final LabeledSubvolume labeledSubvolume) {

		return extract(labeledSubvolume).iterator();
	}

	public static List<Tuple2<Tuple2<Integer, Integer>, Tuple2<Subvolume, LabelBlock>>> extract(final LabeledSubvolume labeledSubvolume) {

		final Subvolume subvolume = labeledSubvolume.subvolume();
		final Box withBorder = subvolume.boxWithBorder();
		final List<Tuple2<Tuple2<Integer, Integer>, Tuple2<Subvolume, LabelBlock>>> boundaries = new ArrayList<>();

		for (final Subvolume neighbor : subvolume.neighbors()) {
			final LabelBlock crop = crop(labeledSubvolume.labels(), withBorder, neighbor.boxWithBorder());
			if (crop.isEmpty())
				LOG.warn("Subvolumes {} and {} do not overlap. Labels will not be merged across their boundary. Use a border of at least 1.", subvolume.index(), neighbor.index());

			final Tuple2<Integer, Integer> key = subvolume.index() < neighbor.index()
					? new Tuple2<>(subvolume.index(), neighbor.index())
					: new Tuple2<>(neighbor.index(), subvolume.index());
			LOG.debug("Extracted boundary {} with {} voxels for subvolume {}", key, crop.numElements(), subvolume.index());
			boundaries.add(new Tuple2<>(key, new Tuple2<>(subvolume.shallow(), crop)));
		}

		return boundaries;
	}

	/**
	 * Crop the intersection of {@code box1} and {@code box2}, computed independently along each axis.
	 */
	static LabelBlock crop(final LabelBlock labels, final Box box1, final Box box2) {

		final long[] min = new long[box1.numDimensions()];
		final long[] max = new long[box1.numDimensions()];
		final long[] dimensions = new long[box1.numDimensions()];
		boolean isEmpty = false;
		for (int d = 0; d < min.length; ++d) {
			min[d] = Math.max(box1.min(d), box2.min(d));
			max[d] = Math.min(box1.max(d), box2.max(d));
			dimensions[d] = Math.max(max[d] - min[d] + 1, 0);
			isEmpty |= dimensions[d] == 0;
		}
		return isEmpty ? LabelBlock.empty(min, dimensions) : labels.crop(new FinalInterval(min, max));
	}
}
