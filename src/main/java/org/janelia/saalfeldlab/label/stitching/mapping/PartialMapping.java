package org.janelia.saalfeldlab.label.stitching.mapping;

import gnu.trove.map.TLongLongMap;
import gnu.trove.map.hash.TLongLongHashMap;

/**
 * Mapping with pass-through semantics: labels that are not keys map to themselves.
 */
public class PartialMapping extends LabelMapping {

	private static final long serialVersionUID = 4462087395573408120L;

	public PartialMapping(final TLongLongMap map) {

		super(map);
	}

	public static PartialMapping empty() {

		return new PartialMapping(new TLongLongHashMap());
	}

	@Override
	public long apply(final long label) {

		return map.containsKey(label) ? map.get(label) : label;
	}
}
