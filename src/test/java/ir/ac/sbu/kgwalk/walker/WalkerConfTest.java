package ir.ac.sbu.kgwalk.walker;

import com.typesafe.config.ConfigFactory;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class WalkerConfTest {

    @Test
    public void testReferenceDefaults() {
        WalkerConf conf = WalkerConf.load();

        assertEquals(4, conf.getDepth());
        assertEquals(100, conf.getWalksPerGraph());
        assertEquals(4, conf.getWlIterations());
        assertEquals(42L, conf.getSeed());
        assertEquals(1, conf.getThreads());
    }

    @Test
    public void testOverrides() {
        WalkerConf conf = WalkerConf.load(ConfigFactory
                .parseString("walker { depth = 2, wlIterations = 1, threads = 3 }")
                .withFallback(ConfigFactory.defaultReference()));

        assertEquals(2, conf.getDepth());
        assertEquals(1, conf.getWlIterations());
        assertEquals(3, conf.getThreads());
        assertEquals(100, conf.getWalksPerGraph());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidValueRejected() {
        WalkerConf.load(ConfigFactory.parseString("walker { walksPerGraph = 0 }")
                .withFallback(ConfigFactory.defaultReference()));
    }
}
