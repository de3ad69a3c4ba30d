package ir.ac.sbu.kgwalk.walker;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configure the Weisfeiler-Lehman walker. Defaults live in the walker block of reference.conf.
 */
public class WalkerConf {
    private static final Logger logger = LoggerFactory.getLogger(WalkerConf.class);

    public static final String PATH = "walker";

    private final int depth;
    private final int walksPerGraph;
    private final int wlIterations;
    private final long seed;
    private final int threads;

    public WalkerConf(Config conf) {
        this(conf.getInt("depth"),
                conf.getInt("walksPerGraph"),
                conf.getInt("wlIterations"),
                conf.getLong("seed"),
                conf.getInt("threads"));
    }

    public WalkerConf(int depth, int walksPerGraph, int wlIterations, long seed, int threads) {
        Validate.isTrue(depth > 0, "depth must be positive: %d", depth);
        Validate.isTrue(walksPerGraph > 0, "walksPerGraph must be positive: %d", walksPerGraph);
        Validate.isTrue(wlIterations >= 0, "wlIterations must not be negative: %d", wlIterations);
        Validate.isTrue(threads > 0, "threads must be positive: %d", threads);
        this.depth = depth;
        this.walksPerGraph = walksPerGraph;
        this.wlIterations = wlIterations;
        this.seed = seed;
        this.threads = threads;

        logger.info("****************** Walker Properties ******************");
        logger.info(toString());
        logger.info("*******************************************************");
    }

    /**
     * Loads the walker block of the application config, application.conf on the classpath
     * overriding reference.conf.
     */
    public static WalkerConf load() {
        return load(ConfigFactory.load());
    }

    public static WalkerConf load(Config root) {
        return new WalkerConf(root.getConfig(PATH));
    }

    public int getDepth() {
        return depth;
    }

    public int getWalksPerGraph() {
        return walksPerGraph;
    }

    public int getWlIterations() {
        return wlIterations;
    }

    public long getSeed() {
        return seed;
    }

    public int getThreads() {
        return threads;
    }

    @Override
    public String toString() {

        return  "depth: " + depth + "\n" +
                "walksPerGraph: " + walksPerGraph + "\n" +
                "wlIterations: " + wlIterations + "\n" +
                "seed: " + seed + "\n" +
                "threads: " + threads + "\n";
    }
}
