package org.janelia.saalfeldlab.label.stitching.exception;

/**
 * Thrown when a label is looked up in a {@link org.janelia.saalfeldlab.label.stitching.mapping.TotalMapping}
 * that does not contain it, e.g. while composing a chain of mappings.
 */
public class IncompleteMappingException extends RuntimeException {

	private static final long serialVersionUID = -2467510896512207321L;

	private final long missingKey;

	public IncompleteMappingException(final long missingKey) {

		super("Mapping does not contain label " + missingKey);
		this.missingKey = missingKey;
	}

	public long getMissingKey() {

		return missingKey;
	}
}
