package org.janelia.saalfeldlab.label.stitching.exception;

public class NonReversibleMappingException extends RuntimeException {

	private static final long serialVersionUID = 5349118203651872470L;

	public NonReversibleMappingException(final long value, final long firstKey, final long secondKey) {

		super(String.format("Mapping is not reversible: labels %d and %d both map to %d", firstKey, secondKey, value));
	}
}
