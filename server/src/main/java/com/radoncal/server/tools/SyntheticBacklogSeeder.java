package com.radoncal.server.tools;

import com.radoncal.db.JdbcBacklogStore;
import com.radoncal.db.SqliteBacklogStore;
import com.radoncal.db.BacklogStoreFactory;
import com.radoncal.server.imaging.EllipseImageGenerator;
import com.radoncal.server.imaging.ImageOps;
import com.radoncal.server.ingest.FileBandImageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Offline tool that fills a data directory with synthetic elliptical sources
 * and registers their bands in a SQLite backlog.
 * Usage: SyntheticBacklogSeeder <dataDir> <count> [seed] [maxRunningCount]
 */
public class SyntheticBacklogSeeder {

    private static final Logger logger = LoggerFactory.getLogger(SyntheticBacklogSeeder.class);

    public static final int IMAGE_SIZE = 40;
    public static final int SOURCES_PER_BIN = 100;

    // relative brightness of g, r, i, z
    private static final double[] BAND_BRIGHTNESS = {0.6, 1.0, 0.9, 0.75};

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: SyntheticBacklogSeeder <dataDir> <count> [seed] [maxRunningCount]");
            System.exit(1);
        }

        Path dataDir = Paths.get(args[0]);
        int count = Integer.parseInt(args[1]);
        long seed = args.length > 2 ? Long.parseLong(args[2]) : System.currentTimeMillis();
        int maxRunningCount = args.length > 3 ? Integer.parseInt(args[3]) : 100;

        String dbPath = dataDir.resolve("radon_backlog.db").toString();
        SqliteBacklogStore store = new SqliteBacklogStore(dbPath, maxRunningCount,
                BacklogStoreFactory.DEFAULT_BUSY_TIMEOUT_MILLIS);
        try {
            store.initialize();
            Map<String, Integer> seeded = seed(store, dataDir, count, seed);
            logger.info("Seeded {} sources into {}", seeded.size(), dbPath);
        } catch (IOException | SQLException e) {
            logger.error("Seeding failed", e);
            System.exit(2);
        }
    }

    /**
     * Writes {@code count} sources and registers every band of each.
     *
     * @return the true major-axis angle of each seeded source, by source id
     */
    public static Map<String, Integer> seed(JdbcBacklogStore store, Path dataDir, int count, long seed)
            throws IOException, SQLException {
        EllipseImageGenerator generator = new EllipseImageGenerator(IMAGE_SIZE, 1.0, 0.03, seed);
        Map<String, Integer> angles = new LinkedHashMap<>();

        for (int i = 0; i < count; i++) {
            String sourceId = String.format("src%06d", i);
            String binId = String.valueOf(i / SOURCES_PER_BIN);
            EllipseImageGenerator.Ellipse ellipse = generator.generateRandom(8, 16, 3, 7);

            double[][][] rasters = new double[FileBandImageSource.BANDS.length()][][];
            for (int b = 0; b < rasters.length; b++) {
                rasters[b] = ImageOps.copy(ellipse.getPixels());
                ImageOps.scaleInPlace(rasters[b], BAND_BRIGHTNESS[b]);
            }
            FileBandImageSource.write(dataDir, sourceId, binId, rasters);

            for (char band : FileBandImageSource.BANDS.toCharArray()) {
                store.registerBand(sourceId, binId, String.valueOf(band));
            }
            angles.put(sourceId, ellipse.getAngleDegrees());
        }
        return angles;
    }
}
