package org.janelia.saalfeldlab.label.stitching.split;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.apache.commons.lang3.time.DurationFormatUtils;
import org.janelia.saalfeldlab.label.stitching.N5Helpers;
import org.janelia.saalfeldlab.label.stitching.exception.InputSameAsOutput;
import org.janelia.saalfeldlab.label.stitching.exception.InvalidDataType;
import org.janelia.saalfeldlab.label.stitching.exception.InvalidDataset;
import org.janelia.saalfeldlab.label.stitching.exception.InvalidN5Container;
import org.janelia.saalfeldlab.label.stitching.mapping.TotalMapping;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.janelia.saalfeldlab.n5.imglib2.N5Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.IntegerType;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Split disconnected labels of an N5 dataset and store the split labels together with the mapping from new
 * labels to the labels they were split from.
 */
public class SplitDisconnectedBodiesTool {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	public static class CommandLineParameters implements Callable<Boolean> {

		@Parameters(index = "0", paramLabel = "CONTAINER", description = "N5 container")
		private String container;

		@Parameters(index = "1", paramLabel = "INPUT_DATASET", description = "Integer type label dataset")
		private String inputDataset;

		@Parameters(index = "2", paramLabel = "OUTPUT_DATASET", description = "Split labels")
		private String outputDataset;

		@Option(names = {"--block-size"}, paramLabel = "BLOCK_SIZE", description = "Block size of output. Defaults to block size of INPUT_DATASET.", split = ",")
		private int[] blockSize;

		@Option(names = {"-h", "--help"}, usageHelp = true, description = "display a help message")
		private boolean helpRequested;

		@Override
		public Boolean call() throws Exception {

			if (this.container == null)
				throw new InvalidN5Container("CONTAINER", this.container);

			if (this.inputDataset == null)
				throw new InvalidDataset("INPUT_DATASET", this.inputDataset);

			if (this.outputDataset == null)
				throw new InvalidDataset("OUTPUT_DATASET", this.outputDataset);

			final long startTime = System.currentTimeMillis();
			final long maxId = split(container, inputDataset, outputDataset, blockSize);
			final String formattedTime = DurationFormatUtils.formatDuration(System.currentTimeMillis() - startTime, "HH:mm:ss.SSS");
			LOG.info("Split disconnected labels of {}:{} into {} with max id {} in {}", container, inputDataset, outputDataset, maxId, formattedTime);
			return true;
		}
	}

	public static void run(final String... args) {

		CommandLine.call(new CommandLineParameters(), System.err, args);
	}

	/**
	 * @param blockSize block size of the output dataset, or {@code null} to use the block size of the input dataset
	 * @return max id of the split labels
	 */
	@SuppressWarnings("unchecked")
	public static <I extends IntegerType<I> & NativeType<I>> long split(
			final String container,
			final String inputDataset,
			final String outputDataset,
			final int[] blockSize) throws IOException, InvalidN5Container, InvalidDataset, InvalidDataType, InputSameAsOutput {

		if (inputDataset.equals(outputDataset))
			throw new InputSameAsOutput(container, inputDataset);

		final N5Writer n5 = N5Helpers.n5Writer(container);
		final DatasetAttributes inputAttributes = N5Helpers.validateLabelDataset(n5, container, inputDataset);
		final RandomAccessibleInterval<I> labels = (RandomAccessibleInterval<I>)N5Utils.open(n5, inputDataset);

		final SplitDisconnectedBodies.SplitResult result = SplitDisconnectedBodies.split(labels);
		LOG.debug("Split {} labels from {}", result.newToOriginal().size(), inputDataset);

		final int[] outputBlockSize = Optional.ofNullable(blockSize).orElse(inputAttributes.getBlockSize());
		N5Utils.save(result.labels(), n5, outputDataset, outputBlockSize, new GzipCompression());
		n5.setAttribute(outputDataset, N5Helpers.MAX_ID_KEY, result.maxLabel());
		n5.setAttribute(outputDataset, N5Helpers.NEW_TO_ORIGINAL_KEY, asSortedMap(result.newToOriginal()));
		return result.maxLabel();
	}

	static Map<String, Long> asSortedMap(final TotalMapping mapping) {

		final Map<String, Long> map = new LinkedHashMap<>();
		for (final long key : mapping.sortedKeys())
			map.put(Long.toString(key), mapping.apply(key));
		return map;
	}
}
