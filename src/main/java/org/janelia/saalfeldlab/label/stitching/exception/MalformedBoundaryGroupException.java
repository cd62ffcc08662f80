package org.janelia.saalfeldlab.label.stitching.exception;

/**
 * A boundary between two subvolumes did not collect exactly two contributions of equal shape.
 * This points to an inconsistent partitioning and aborts the whole stitch.
 */
public class MalformedBoundaryGroupException extends RuntimeException {

	private static final long serialVersionUID = -4187025873398211650L;

	public MalformedBoundaryGroupException(final String message) {

		super(message);
	}
}
