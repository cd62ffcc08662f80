package org.janelia.saalfeldlab.label.stitching.stitch;

import org.janelia.saalfeldlab.label.stitching.LabelBlock;
import org.janelia.saalfeldlab.label.stitching.split.ConsecutiveLabels;
import org.janelia.saalfeldlab.label.stitching.subvolume.Subvolume;

/**
 * Keep the labels of the block and only renumber them to {@code 1..n}.
 */
public class ConsecutiveSegmenter implements BlockSegmenter {

	private static final long serialVersionUID = -5608265339107542217L;

	@Override
	public LabeledSubvolume segment(final Subvolume subvolume, final LabelBlock block) {

		final ConsecutiveLabels consecutive = ConsecutiveLabels.relabel(block.img());
		final LabelBlock labels = block.withData(consecutive.labels().update(null).getCurrentStorageArray());
		return new LabeledSubvolume(subvolume, labels, consecutive.numLabels());
	}
}
