package org.janelia.saalfeldlab.label.stitching;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.janelia.saalfeldlab.label.stitching.exception.InvalidDataType;
import org.janelia.saalfeldlab.label.stitching.exception.InvalidDataset;
import org.janelia.saalfeldlab.label.stitching.exception.InvalidN5Container;
import org.janelia.saalfeldlab.n5.DataType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pl.touk.throwing.ThrowingBiConsumer;

public class N5Helpers {

	public static final String MAX_ID_KEY = "maxId";

	public static final String NEW_TO_ORIGINAL_KEY = "newToOriginal";

	public static final String ARGV_KEY = "argv";

	private static final Set<DataType> LABEL_DATA_TYPES = EnumSet.of(
			DataType.INT8,
			DataType.UINT8,
			DataType.INT16,
			DataType.UINT16,
			DataType.INT32,
			DataType.UINT32,
			DataType.INT64,
			DataType.UINT64);

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	public static N5Writer n5Writer(final String base) throws IOException {

		return new N5FSWriter(base);
	}

	public static long[] blockPos(final long[] position, final int[] blockSize) {

		final long[] blockPos = new long[position.length];
		Arrays.setAll(blockPos, d -> position[d] / blockSize[d]);
		return blockPos;
	}

	public static boolean isLabelDataType(final DataType dataType) {

		return LABEL_DATA_TYPES.contains(dataType);
	}

	/**
	 * Check that {@code dataset} exists in {@code container} and holds integer labels.
	 *
	 * @return attributes of {@code dataset}
	 */
	public static DatasetAttributes validateLabelDataset(
			final N5Reader n5,
			final String container,
			final String dataset) throws InvalidN5Container, InvalidDataset, InvalidDataType {

		if (!n5.exists("/"))
			throw new InvalidN5Container("input", container);

		if (!n5.datasetExists(dataset))
			throw new InvalidDataset("input", dataset);

		final DatasetAttributes attributes = n5.getDatasetAttributes(dataset);
		if (!isLabelDataType(attributes.getDataType()))
			throw new InvalidDataType(attributes.getDataType());

		LOG.debug("Found label dataset {} in {} with dimensions {} and data type {}", dataset, container, attributes.getDimensions(), attributes.getDataType());
		return attributes;
	}

	public static DatasetAttributes prepareOutputDataset(
			final N5Writer n5,
			final String dataset,
			final long[] dimensions,
			final int[] blockSize,
			final Map<String, Object> additionalAttributes) throws IOException {

		final DatasetAttributes attributes = new DatasetAttributes(dimensions, blockSize, DataType.UINT64, new GzipCompression());
		n5.createDataset(dataset, attributes);
		additionalAttributes.forEach(ThrowingBiConsumer.unchecked((key, value) -> n5.setAttribute(dataset, key, value)));
		LOG.debug("Created dataset {} with dimensions {} and block size {}", dataset, dimensions, blockSize);
		return attributes;
	}
}
