package org.janelia.saalfeldlab.label.stitching.subvolume;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.lang3.builder.ToStringBuilder;

import net.imglib2.Interval;

/**
 * Immutable descriptor of one partition of a label volume.
 * Neighbors are shallow descriptors without neighbors of their own.
 */
public class Subvolume implements Serializable {

	private static final long serialVersionUID = -4017254361029364878L;

	private final int index;

	private final Box box;

	private final long border;

	private final List<Subvolume> neighbors;

	public Subvolume(final int index, final Box box, final long border) {

		this(index, box, border, Collections.emptyList());
	}

	public Subvolume(final int index, final Box box, final long border, final List<Subvolume> neighbors) {

		this.index = index;
		this.box = box;
		this.border = border;
		this.neighbors = Collections.unmodifiableList(neighbors
				.stream()
				.map(Subvolume::shallow)
				.collect(Collectors.toCollection(ArrayList::new)));
	}

	public int index() {

		return index;
	}

	public Box box() {

		return box;
	}

	public long border() {

		return border;
	}

	public Box boxWithBorder() {

		return box.expand(border);
	}

	public Interval intervalWithBorder() {

		return boxWithBorder().interval();
	}

	public List<Subvolume> neighbors() {

		return neighbors;
	}

	public Subvolume shallow() {

		return neighbors.isEmpty() ? this : new Subvolume(index, box, border);
	}

	@Override
	public String toString() {

		return new ToStringBuilder(this)
				.append("index", index)
				.append("box", box)
				.append("border", border)
				.append("neighbors", neighbors.stream().map(Subvolume::index).collect(Collectors.toList()))
				.toString();
	}
}
