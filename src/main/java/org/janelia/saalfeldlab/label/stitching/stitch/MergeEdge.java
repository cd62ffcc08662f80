package org.janelia.saalfeldlab.label.stitching.stitch;

import java.io.Serializable;

/**
 * Request to merge global label {@code from} of the lower index subvolume into global label {@code to} of
 * the higher index subvolume.
 */
public class MergeEdge implements Serializable, Comparable<MergeEdge> {

	private static final long serialVersionUID = 7719361208457520381L;

	private final long from;

	private final long to;

	public MergeEdge(final long from, final long to) {

		this.from = from;
		this.to = to;
	}

	public long from() {

		return from;
	}

	public long to() {

		return to;
	}

	@Override
	public int compareTo(final MergeEdge other) {

		final int compareFrom = Long.compare(from, other.from);
		return compareFrom == 0 ? Long.compare(to, other.to) : compareFrom;
	}

	@Override
	public boolean equals(final Object other) {

		return other instanceof MergeEdge && ((MergeEdge)other).from == from && ((MergeEdge)other).to == to;
	}

	@Override
	public int hashCode() {

		return 31 * Long.hashCode(from) + Long.hashCode(to);
	}

	@Override
	public String toString() {

		return "(" + from + ", " + to + ")";
	}
}
