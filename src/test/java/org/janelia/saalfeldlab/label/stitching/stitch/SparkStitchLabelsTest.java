package org.janelia.saalfeldlab.label.stitching.stitch;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.spark.api.java.JavaSparkContext;
import org.janelia.saalfeldlab.label.stitching.N5Helpers;
import org.janelia.saalfeldlab.label.stitching.exception.InputSameAsOutput;
import org.janelia.saalfeldlab.label.stitching.exception.InvalidDataType;
import org.janelia.saalfeldlab.label.stitching.exception.InvalidDataset;
import org.janelia.saalfeldlab.label.stitching.exception.InvalidN5Container;
import org.janelia.saalfeldlab.n5.DataType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.N5FSReader;
import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.n5.RawCompression;
import org.janelia.saalfeldlab.n5.imglib2.N5Utils;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Assert;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.numeric.integer.UnsignedLongType;
import net.imglib2.view.Views;

public class SparkStitchLabelsTest {

	private static final String INPUT_DATASET = "volumes/labels/input";

	private static final String OUTPUT_DATASET = "volumes/labels/stitched";

	private static JavaSparkContext sc;

	private String tmpDir;

	@BeforeClass
	public static void setUpSpark() {

		sc = new JavaSparkContext(StitchingTestData.sparkConf(SparkStitchLabelsTest.class));
	}

	@AfterClass
	public static void tearDownSpark() {

		sc.close();
	}

	@Before
	public void setUp() throws IOException {

		this.tmpDir = Files.createTempDirectory("spark-stitch-labels-test").toAbsolutePath().toString();
		final ArrayImg<UnsignedLongType, LongArray> labels = ArrayImgs.unsignedLongs(StitchingTestData.DIMENSIONS);
		final Cursor<UnsignedLongType> cursor = labels.localizingCursor();
		final long[] position = new long[3];
		while (cursor.hasNext()) {
			cursor.fwd();
			cursor.localize(position);
			cursor.get().set(StitchingTestData.label(position));
		}
		final N5FSWriter n5 = new N5FSWriter(tmpDir);
		N5Utils.save(labels, n5, INPUT_DATASET, StitchingTestData.SUBVOLUME_SIZE, new RawCompression());
	}

	@After
	public void tearDown() throws IOException {

		FileUtils.deleteDirectory(new File(this.tmpDir));
	}

	private void assertStitched(final long maxId) {

		final N5Reader n5 = new N5FSReader(tmpDir);
		final DatasetAttributes attributes = n5.getDatasetAttributes(OUTPUT_DATASET);
		Assert.assertArrayEquals(StitchingTestData.DIMENSIONS, attributes.getDimensions());
		Assert.assertArrayEquals(new int[]{2, 2, 2}, attributes.getBlockSize());
		Assert.assertEquals(DataType.UINT64, attributes.getDataType());
		Assert.assertEquals(maxId, (long)n5.getAttribute(OUTPUT_DATASET, N5Helpers.MAX_ID_KEY, Long.class));
		Assert.assertNotNull(n5.getAttribute(OUTPUT_DATASET, SparkStitchLabels.RUN_INFO_KEY, Map.class));

		final RandomAccessibleInterval<UnsignedLongType> stitched = N5Utils.open(n5, OUTPUT_DATASET);
		final Cursor<UnsignedLongType> cursor = Views.flatIterable(stitched).localizingCursor();
		final long[] position = new long[3];
		while (cursor.hasNext()) {
			cursor.fwd();
			cursor.localize(position);
			Assert.assertEquals(StitchingTestData.stitchedLabel(position), cursor.get().getIntegerLong());
		}
	}

	@Test
	public void testConnectedComponents() throws IOException, InvalidN5Container, InvalidDataset, InvalidDataType, InputSameAsOutput {

		final long maxId = SparkStitchLabels.run(
				sc,
				tmpDir,
				"--input-dataset", INPUT_DATASET,
				"--output-dataset", OUTPUT_DATASET,
				"--block-size", "2,2,2",
				"--blocks-per-task", "2,2,2",
				"--border", "1");
		Assert.assertEquals(4, maxId);
		assertStitched(maxId);
	}

	@Test
	public void testConsecutive() throws IOException, InvalidN5Container, InvalidDataset, InvalidDataType, InputSameAsOutput {

		final long maxId = SparkStitchLabels.run(
				sc,
				tmpDir,
				"--input-dataset", INPUT_DATASET,
				"--output-dataset", OUTPUT_DATASET,
				"--block-size", "2,2,2",
				"--blocks-per-task", "2,2,2",
				"--segmentation", "consecutive");
		Assert.assertEquals(4, maxId);
		assertStitched(maxId);
	}

	@Test(expected = InputSameAsOutput.class)
	public void testInputSameAsOutput() throws IOException, InvalidN5Container, InvalidDataset, InvalidDataType, InputSameAsOutput {

		SparkStitchLabels.run(sc, tmpDir, "--input-dataset", INPUT_DATASET, "--output-dataset", "/" + INPUT_DATASET + "/");
	}

	@Test(expected = InvalidDataset.class)
	public void testMissingDataset() throws IOException, InvalidN5Container, InvalidDataset, InvalidDataType, InputSameAsOutput {

		SparkStitchLabels.run(sc, tmpDir, "--input-dataset", "does/not/exist");
	}
}
