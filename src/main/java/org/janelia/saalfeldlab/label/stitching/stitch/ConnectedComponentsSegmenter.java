package org.janelia.saalfeldlab.label.stitching.stitch;

import org.janelia.saalfeldlab.label.stitching.LabelBlock;
import org.janelia.saalfeldlab.label.stitching.split.ConnectedComponentsOfLabels;
import org.janelia.saalfeldlab.label.stitching.subvolume.Subvolume;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.numeric.integer.UnsignedLongType;

/**
 * Connected components of each label within the block, numbered {@code 1..n}.
 */
public class ConnectedComponentsSegmenter implements BlockSegmenter {

	private static final long serialVersionUID = 1533792637411620478L;

	@Override
	public LabeledSubvolume segment(final Subvolume subvolume, final LabelBlock block) {

		final ArrayImg<UnsignedLongType, LongArray> components = ConnectedComponentsOfLabels.label(block.img());
		final LabelBlock labels = block.withData(components.update(null).getCurrentStorageArray());
		return new LabeledSubvolume(subvolume, labels, labels.maxLabel());
	}
}
