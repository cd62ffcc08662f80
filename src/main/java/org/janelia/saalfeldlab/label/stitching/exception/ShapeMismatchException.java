package org.janelia.saalfeldlab.label.stitching.exception;

import java.util.Arrays;

public class ShapeMismatchException extends RuntimeException {

	private static final long serialVersionUID = 1930464719826120945L;

	public ShapeMismatchException(final long[] dimensionsA, final long[] dimensionsB) {

		super("Label volumes have different shapes: " + Arrays.toString(dimensionsA) + " and " + Arrays.toString(dimensionsB));
	}
}
