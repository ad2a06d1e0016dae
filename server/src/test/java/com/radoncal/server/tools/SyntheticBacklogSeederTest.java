package com.radoncal.server.tools;

import com.radoncal.db.BandStatus;
import com.radoncal.db.SqliteBacklogStore;
import com.radoncal.server.imaging.BandImage;
import com.radoncal.server.ingest.FileBandImageSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

public class SyntheticBacklogSeederTest {

    @Test
    public void testSeedsFilesAndBacklog(@TempDir Path dataDir) throws Exception {
        SqliteBacklogStore store = new SqliteBacklogStore(dataDir.resolve("seed.db").toString(), 100, 1000);
        store.initialize();

        Map<String, Integer> angles = SyntheticBacklogSeeder.seed(store, dataDir, 3, 21L);

        Assertions.assertEquals(3, angles.size());
        Assertions.assertEquals(12, store.countByStatus(BandStatus.PENDING));
        for (int angle : angles.values()) {
            Assertions.assertTrue(angle >= 0 && angle < 180);
        }

        FileBandImageSource source = new FileBandImageSource(dataDir.toString());
        String firstSource = angles.keySet().iterator().next();
        BandImage g = source.load(firstSource, "0", "g");
        BandImage r = source.load(firstSource, "0", "r");
        Assertions.assertEquals(SyntheticBacklogSeeder.IMAGE_SIZE, g.getPixels().length);
        Assertions.assertTrue(g.isValid() && r.isValid());
    }

    @Test
    public void testReseedingDoesNotDuplicateBands(@TempDir Path dataDir) throws Exception {
        SqliteBacklogStore store = new SqliteBacklogStore(dataDir.resolve("seed.db").toString(), 100, 1000);
        store.initialize();

        SyntheticBacklogSeeder.seed(store, dataDir, 2, 1L);
        SyntheticBacklogSeeder.seed(store, dataDir, 2, 1L);

        Assertions.assertEquals(8, store.countByStatus(BandStatus.PENDING));
    }
}
