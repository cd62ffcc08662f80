package org.janelia.saalfeldlab.label.stitching.stitch;

import java.io.Serializable;

import org.janelia.saalfeldlab.label.stitching.LabelBlock;
import org.janelia.saalfeldlab.label.stitching.subvolume.Subvolume;

/**
 * Labels of a {@link Subvolume} including its border, with the highest label id that occurs in the labels.
 */
public class LabeledSubvolume implements Serializable {

	private static final long serialVersionUID = 4476126028475219310L;

	private final Subvolume subvolume;

	private final LabelBlock labels;

	private final long maxId;

	public LabeledSubvolume(final Subvolume subvolume, final LabelBlock labels, final long maxId) {

		this.subvolume = subvolume;
		this.labels = labels;
		this.maxId = maxId;
	}

	public Subvolume subvolume() {

		return subvolume;
	}

	public LabelBlock labels() {

		return labels;
	}

	public long maxId() {

		return maxId;
	}

	@Override
	public String toString() {

		return String.format("LabeledSubvolume(index=%d maxId=%d labels=%s)", subvolume.index(), maxId, labels);
	}
}
