package org.janelia.saalfeldlab.label.stitching.stitch;

import java.io.Serializable;

import org.janelia.saalfeldlab.label.stitching.LabelBlock;
import org.janelia.saalfeldlab.label.stitching.subvolume.Subvolume;

/**
 * Label a single subvolume independently of all others. Labels must be in {@code [0, maxId]} and 0 is background.
 */
public interface BlockSegmenter extends Serializable {

	LabeledSubvolume segment(Subvolume subvolume, LabelBlock block);

}
