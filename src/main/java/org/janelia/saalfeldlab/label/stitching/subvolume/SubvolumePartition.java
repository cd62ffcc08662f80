package org.janelia.saalfeldlab.label.stitching.subvolume;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.algorithm.util.Grids;
import net.imglib2.util.Intervals;

public class SubvolumePartition {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	public enum PartitionFilter {
		ALL,
		/**
		 * Only keep subvolumes that are fully contained in the volume including their border.
		 */
		INTERIOR_ONLY
	}

	private SubvolumePartition() {

	}

	public static List<Subvolume> gridAligned(final long[] dimensions, final int[] chunkSize, final long border) {

		return gridAligned(dimensions, chunkSize, border, PartitionFilter.ALL);
	}

	/**
	 * Tile a volume with origin 0 into chunks of {@code chunkSize}. Chunks at the upper boundary are cropped.
	 * Indices are assigned in grid order (dimension 0 fastest) after filtering.
	 */
	public static List<Subvolume> gridAligned(
			final long[] dimensions,
			final int[] chunkSize,
			final long border,
			final PartitionFilter filter) {

		final Interval volume = new FinalInterval(dimensions);
		final List<Box> boxes = Grids
				.collectAllContainedIntervals(dimensions, chunkSize)
				.stream()
				.map(Box::of)
				.filter(box -> filter != PartitionFilter.INTERIOR_ONLY || Intervals.contains(volume, box.expand(border).interval()))
				.collect(Collectors.toList());
		LOG.debug("Partitioned volume {} into {} chunks of size {}", dimensions, boxes.size(), chunkSize);
		return withNeighbors(boxes, border);
	}

	/**
	 * Create subvolumes with indices {@code 0..boxes.size()-1} and record all pairs that share a face as neighbors.
	 */
	public static List<Subvolume> withNeighbors(final List<Box> boxes, final long border) {

		final List<List<Subvolume>> neighbors = new ArrayList<>();
		for (int i = 0; i < boxes.size(); ++i)
			neighbors.add(new ArrayList<>());

		for (int i = 0; i < boxes.size() - 1; ++i) {
			for (int j = i + 1; j < boxes.size(); ++j) {
				if (boxes.get(i).sharesFace(boxes.get(j))) {
					neighbors.get(i).add(new Subvolume(j, boxes.get(j), border));
					neighbors.get(j).add(new Subvolume(i, boxes.get(i), border));
				}
			}
		}

		final List<Subvolume> subvolumes = new ArrayList<>();
		for (int i = 0; i < boxes.size(); ++i)
			subvolumes.add(new Subvolume(i, boxes.get(i), border, neighbors.get(i)));
		return subvolumes;
	}
}
