package org.janelia.saalfeldlab.label.stitching.stitch;

import java.lang.invoke.MethodHandles;

import org.apache.spark.api.java.function.Function;
import org.apache.spark.broadcast.Broadcast;
import org.janelia.saalfeldlab.label.stitching.LabelBlock;
import org.janelia.saalfeldlab.label.stitching.mapping.PartialMapping;
import org.janelia.saalfeldlab.label.stitching.mapping.TotalMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gnu.trove.set.hash.TLongHashSet;

/**
 * Move the labels of a subvolume into its global label range and apply the merges.
 */
public class RelabelSubvolume implements Function<LabeledSubvolume, LabeledSubvolume> {

	private static final long serialVersionUID = -1086530912887514937L;

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	private final Broadcast<OffsetAssignment> offsets;

	private final Broadcast<PartialMapping> equivalences;

	public RelabelSubvolume(final Broadcast<OffsetAssignment> offsets, final Broadcast<PartialMapping> equivalences) {

		this.offsets = offsets;
		this.equivalences = equivalences;
	}

	@Override
	public LabeledSubvolume call(final LabeledSubvolume labeledSubvolume) {

		return relabel(labeledSubvolume, offsets.getValue(), equivalences.getValue());
	}

	public static LabeledSubvolume relabel(
			final LabeledSubvolume labeledSubvolume,
			final OffsetAssignment offsets,
			final PartialMapping equivalences) {

		final long offset = offsets.offset(labeledSubvolume.subvolume().index());
		final long[] labels = labeledSubvolume.labels().data().clone();
		final TLongHashSet uniqueLabels = new TLongHashSet();
		for (int i = 0; i < labels.length; ++i) {
			if (labels[i] != 0)
				labels[i] += offset;
			uniqueLabels.add(labels[i]);
		}

		final TotalMapping.Builder mappingBuilder = new TotalMapping.Builder();
		uniqueLabels.forEach(label -> {
			mappingBuilder.put(label, equivalences.apply(label));
			return true;
		});
		final TotalMapping mapping = mappingBuilder.build();
		mapping.applyInPlace(labels);

		final LabelBlock relabeled = labeledSubvolume.labels().withData(labels);
		LOG.debug("Relabeled subvolume {} with offset {} and {} unique labels", labeledSubvolume.subvolume().index(), offset, uniqueLabels.size());
		return new LabeledSubvolume(labeledSubvolume.subvolume(), relabeled, relabeled.maxLabel());
	}
}
