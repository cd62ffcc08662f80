package org.janelia.saalfeldlab.label.stitching.stitch;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.spark.api.java.function.PairFunction;
import org.apache.spark.broadcast.Broadcast;
import org.janelia.saalfeldlab.label.stitching.LabelBlock;
import org.janelia.saalfeldlab.label.stitching.exception.MalformedBoundaryGroupException;
import org.janelia.saalfeldlab.label.stitching.overlap.OverlapTable;
import org.janelia.saalfeldlab.label.stitching.overlap.OverlapTables;
import org.janelia.saalfeldlab.label.stitching.subvolume.Subvolume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gnu.trove.set.hash.TLongHashSet;
import net.imglib2.FinalInterval;
import net.imglib2.type.numeric.integer.UnsignedLongType;
import net.imglib2.view.Views;
import scala.Tuple2;

/**
 * Find labels that continue across the boundary between two subvolumes.
 *
 * Only labels of the higher index subvolume that are present in the central slab of the boundary region are
 * eligible for merging. The central slab is one voxel thick along each axis the two subvolumes touch. Every
 * eligible label is merged with every label of the lower index subvolume it overlaps with anywhere in the
 * boundary region.
 */
public class PairwiseMerge implements PairFunction<Tuple2<Tuple2<Integer, Integer>, Iterable<Tuple2<Subvolume, LabelBlock>>>, Integer, ArrayList<MergeEdge>> {

	private static final long serialVersionUID = 5902817366350184247L;

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	private final Broadcast<OffsetAssignment> offsets;

	public PairwiseMerge(final Broadcast<OffsetAssignment> offsets) {

		this.offsets = offsets;
	}

	@Override
	public Tuple2<Integer, ArrayList<MergeEdge>> call(final Tuple2<Tuple2<Integer, Integer>, Iterable<Tuple2<Subvolume, LabelBlock>>> boundary) {

		return merge(boundary._1(), boundary._2(), offsets.getValue());
	}

	/**
	 * @return index of the lower index subvolume and the merges in global labels
	 * @throws MalformedBoundaryGroupException if there are not exactly two contributions of equal shape
	 */
	public static Tuple2<Integer, ArrayList<MergeEdge>> merge(
			final Tuple2<Integer, Integer> key,
			final Iterable<Tuple2<Subvolume, LabelBlock>> contributions,
			final OffsetAssignment offsets) {

		final List<Tuple2<Subvolume, LabelBlock>> sorted = new ArrayList<>();
		contributions.forEach(sorted::add);
		if (sorted.size() != 2)
			throw new MalformedBoundaryGroupException("Expected exactly two subvolumes for boundary " + key + " but got " + sorted.size());
		sorted.sort((c1, c2) -> Integer.compare(c1._1().index(), c2._1().index()));

		final Subvolume subvolume1 = sorted.get(0)._1();
		final Subvolume subvolume2 = sorted.get(1)._1();
		final LabelBlock boundary1 = sorted.get(0)._2();
		final LabelBlock boundary2 = sorted.get(1)._2();

		if (!Arrays.equals(boundary1.dimensions(), boundary2.dimensions()))
			throw new MalformedBoundaryGroupException(String.format(
					"Boundary %s has different shapes: %s and %s",
					key,
					Arrays.toString(boundary1.dimensions()),
					Arrays.toString(boundary2.dimensions())));

		final ArrayList<MergeEdge> edges = new ArrayList<>();
		if (boundary1.isEmpty())
			return new Tuple2<>(subvolume1.index(), edges);

		final TLongHashSet eligible = eligibleLabels(subvolume1, subvolume2, boundary2);
		final OverlapTable overlap = OverlapTables.build(boundary1.img(), boundary2.img());
		final long offset1 = offsets.offset(subvolume1.index());
		final long offset2 = offsets.offset(subvolume2.index());
		for (final long[] entry : overlap.nonZeroEntries())
			if (entry[0] != 0 && entry[1] != 0 && eligible.contains(entry[1]))
				edges.add(new MergeEdge(entry[0] + offset1, entry[1] + offset2));

		LOG.debug("Found {} merges between subvolumes {} and {}", edges.size(), subvolume1.index(), subvolume2.index());
		return new Tuple2<>(subvolume1.index(), edges);
	}

	private static TLongHashSet eligibleLabels(final Subvolume subvolume1, final Subvolume subvolume2, final LabelBlock boundary2) {

		final long[] dimensions = boundary2.dimensions();
		final long[] min = new long[dimensions.length];
		final long[] max = new long[dimensions.length];
		for (int d = 0; d < dimensions.length; ++d) {
			if (subvolume1.box().touches(subvolume2.box(), d)) {
				min[d] = dimensions[d] / 2;
				max[d] = min[d];
			} else {
				min[d] = 0;
				max[d] = dimensions[d] - 1;
			}
		}

		final TLongHashSet eligible = new TLongHashSet();
		for (final UnsignedLongType label : Views.interval(boundary2.img(), new FinalInterval(min, max)))
			if (label.getIntegerLong() != 0)
				eligible.add(label.getIntegerLong());
		return eligible;
	}
}
