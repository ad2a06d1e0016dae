package com.radoncal.server.ingest;

import com.radoncal.server.imaging.BandImage;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileBandImageSourceTest {

    private static double[][] filled(double value) {
        double[][] raster = new double[4][4];
        for (double[] row : raster) {
            java.util.Arrays.fill(row, value);
        }
        return raster;
    }

    @Test
    public void testLoadsRequestedBand(@TempDir Path dataDir) throws Exception {
        FileBandImageSource.write(dataDir, "s1", "7",
                new double[][][] { filled(1), filled(2), filled(3), filled(4) });

        FileBandImageSource source = new FileBandImageSource(dataDir.toString());

        Assertions.assertTrue(Files.exists(dataDir.resolve("b7").resolve("s1.bands")));
        Assertions.assertEquals(1.0, source.load("s1", "7", "g").getPixels()[0][0]);
        Assertions.assertEquals(3.0, source.load("s1", "7", "i").getPixels()[2][2]);
        BandImage z = source.load("s1", "7", "z");
        Assertions.assertEquals("z", z.getBand());
        Assertions.assertEquals(4.0, z.getPixels()[3][3]);
    }

    @Test
    public void testNegativeRasterIsShifted(@TempDir Path dataDir) throws Exception {
        double[][] r = filled(1);
        r[0][0] = -3;
        FileBandImageSource.write(dataDir, "s2", "0", new double[][][] { filled(1), r, filled(1), filled(1) });

        BandImage band = new FileBandImageSource(dataDir.toString()).load("s2", "0", "r");

        Assertions.assertEquals(0.0, band.getPixels()[0][0]);
        Assertions.assertEquals(4.0, band.getPixels()[1][1]);
    }

    @Test
    public void testUnknownBand(@TempDir Path dataDir) {
        FileBandImageSource source = new FileBandImageSource(dataDir.toString());
        Assertions.assertThrows(InvalidBandException.class, () -> source.load("s1", "0", "u"));
        Assertions.assertThrows(InvalidBandException.class, () -> source.load("s1", "0", null));
    }

    @Test
    public void testMissingFile(@TempDir Path dataDir) {
        FileBandImageSource source = new FileBandImageSource(dataDir.toString());
        Assertions.assertThrows(FileNotFoundException.class, () -> source.load("missing", "0", "g"));
    }

    @Test
    public void testMalformedFile(@TempDir Path dataDir) throws Exception {
        Path file = FileBandImageSource.pathFor(dataDir, "s3", "0");
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[] { 1, 2, 3 });

        FileBandImageSource source = new FileBandImageSource(dataDir.toString());
        Assertions.assertThrows(InvalidBandException.class, () -> source.load("s3", "0", "g"));
    }

    @Test
    public void testNonFiniteBandRejected(@TempDir Path dataDir) throws Exception {
        double[][] bad = filled(1);
        bad[1][2] = Double.NaN;
        FileBandImageSource.write(dataDir, "s4", "0", new double[][][] { bad, filled(1), filled(1), filled(1) });

        FileBandImageSource source = new FileBandImageSource(dataDir.toString());
        Assertions.assertThrows(InvalidBandException.class, () -> source.load("s4", "0", "g"));
        Assertions.assertEquals(1.0, source.load("s4", "0", "r").getPixels()[1][2]);
    }
}
