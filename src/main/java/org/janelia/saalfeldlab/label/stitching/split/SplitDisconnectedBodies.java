package org.janelia.saalfeldlab.label.stitching.split;

import java.lang.invoke.MethodHandles;

import org.janelia.saalfeldlab.label.stitching.LabelBlock;
import org.janelia.saalfeldlab.label.stitching.mapping.TotalMapping;
import org.janelia.saalfeldlab.label.stitching.overlap.OverlapTable;
import org.janelia.saalfeldlab.label.stitching.overlap.OverlapTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gnu.trove.set.hash.TLongHashSet;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.integer.UnsignedLongType;

/**
 * Split labels whose voxels are not connected into one label per connected piece.
 *
 * Labels that are connected keep their id. For a split label, the largest piece keeps the original id and
 * all other pieces receive new ids {@code M+1, M+2, ...} where {@code M} is the highest original label. If
 * two pieces are equally large, the piece that comes first in flat iteration order keeps the id.
 *
 * Label 0 is background and is never split.
 */
public class SplitDisconnectedBodies {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	public static class SplitResult {

		private final ArrayImg<UnsignedLongType, LongArray> labels;

		private final TotalMapping newToOriginal;

		private final long maxLabel;

		private SplitResult(
				final ArrayImg<UnsignedLongType, LongArray> labels,
				final TotalMapping newToOriginal,
				final long maxLabel) {

			this.labels = labels;
			this.newToOriginal = newToOriginal;
			this.maxLabel = maxLabel;
		}

		public ArrayImg<UnsignedLongType, LongArray> labels() {

			return labels;
		}

		/**
		 * Every label that took part in a split, mapped to the label it was split from. This includes the identity
		 * entry of the piece that kept the original id. Labels that were not split are not contained.
		 */
		public TotalMapping newToOriginal() {

			return newToOriginal;
		}

		public long maxLabel() {

			return maxLabel;
		}
	}

	private SplitDisconnectedBodies() {

	}

	public static <I extends IntegerType<I>> SplitResult split(final RandomAccessibleInterval<I> labels) {

		final ConsecutiveLabels consecutive = ConsecutiveLabels.relabel(labels);
		final long numLabels = consecutive.numLabels();
		final long maxOriginal = consecutive.maxOriginalLabel();

		final ArrayImg<UnsignedLongType, LongArray> split = ConnectedComponentsOfLabels.label(consecutive.labels());
		final OverlapTable overlap = OverlapTables.build(consecutive.labels(), split);

		// every split id is contained in exactly one consecutive id
		final TotalMapping.Builder splitToConsecutiveBuilder = new TotalMapping.Builder().put(0, 0);
		overlap.forEachEntry((cons, splitId, count) -> {
			splitToConsecutiveBuilder.put(splitId, cons);
			return true;
		});
		final TotalMapping splitToConsecutive = splitToConsecutiveBuilder.build();
		final long numSplitIds = splitToConsecutive.size() - 1;

		if (numSplitIds == numLabels) {
			LOG.debug("No disconnected labels among {} labels", numLabels);
			return new SplitResult(LabelBlock.copyOf(labels).img(), TotalMapping.empty(), maxOriginal);
		}

		// the main piece of each label keeps the consecutive id, all other pieces are numbered N+1, N+2, ...
		final TotalMapping.Builder splitToConsecutiveWithSplitsBuilder = new TotalMapping.Builder().put(0, 0);
		final TLongHashSet mainSplitIds = new TLongHashSet();
		overlap.argMaxPerRow().forEachEntry((cons, splitId) -> {
			if (cons != 0) {
				splitToConsecutiveWithSplitsBuilder.put(splitId, cons);
				mainSplitIds.add(splitId);
			}
			return true;
		});
		long nextConsecutiveId = numLabels + 1;
		for (final long splitId : splitToConsecutive.sortedKeys())
			if (splitId != 0 && !mainSplitIds.contains(splitId))
				splitToConsecutiveWithSplitsBuilder.put(splitId, nextConsecutiveId++);
		final long numSplits = nextConsecutiveId - numLabels - 1;
		final TotalMapping splitToConsecutiveWithSplits = splitToConsecutiveWithSplitsBuilder.build();

		final TotalMapping consecutiveWithSplitsToConsecutive = TotalMapping.compose(splitToConsecutiveWithSplits.inverse(), splitToConsecutive);
		final TotalMapping consecutiveToOriginal = consecutive.originalToConsecutive().inverse();

		final TotalMapping.Builder consecutiveWithSplitsToOriginalWithSplitsBuilder = new TotalMapping.Builder().putAll(consecutiveToOriginal);
		for (long k = 1; k <= numSplits; ++k)
			consecutiveWithSplitsToOriginalWithSplitsBuilder.put(numLabels + k, maxOriginal + k);
		final TotalMapping consecutiveWithSplitsToOriginalWithSplits = consecutiveWithSplitsToOriginalWithSplitsBuilder.build();

		// split -> consecutiveWithSplits -> originalWithSplits
		final TotalMapping splitToOriginalWithSplits = TotalMapping.compose(splitToConsecutiveWithSplits, consecutiveWithSplitsToOriginalWithSplits);
		splitToOriginalWithSplits.applyInPlace(split.update(null).getCurrentStorageArray());

		// originalWithSplits -> consecutiveWithSplits -> consecutive -> original
		final TotalMapping originalWithSplitsToOriginal = TotalMapping.compose(
				consecutiveWithSplitsToOriginalWithSplits.inverse(),
				consecutiveWithSplitsToConsecutive,
				consecutiveToOriginal);

		final TLongHashSet splitOriginals = new TLongHashSet();
		originalWithSplitsToOriginal.forEachEntry((k, v) -> {
			if (k > maxOriginal)
				splitOriginals.add(v);
			return true;
		});
		final TotalMapping newToOriginal = originalWithSplitsToOriginal.filter((k, v) -> k > maxOriginal || splitOriginals.contains(v));

		LOG.debug("Split {} disconnected labels into {} additional pieces", splitOriginals.size(), numSplits);
		return new SplitResult(split, newToOriginal, maxOriginal + numSplits);
	}
}
