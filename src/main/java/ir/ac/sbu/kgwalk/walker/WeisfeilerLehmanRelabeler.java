package ir.ac.sbu.kgwalk.walker;

import ir.ac.sbu.kgwalk.graph.GraphAccessor;
import ir.ac.sbu.kgwalk.types.Vertex;
import ir.ac.sbu.kgwalk.utils.MultiCoreUtils;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.TreeSet;
import java.util.concurrent.ForkJoinPool;

/**
 * Weisfeiler-Lehman relabeling of all vertices of a graph.
 * <p>
 * In round 0 every vertex is labeled by its name. In round n the distinct round n-1 labels of the
 * inverse neighbors of a vertex are sorted and joined with {@value #SEPARATOR}, the vertex's own
 * round n-1 label and the separator are put in front, and the MD5 digest of that string becomes
 * the round n label.
 * <p>
 * Each round is computed in parallel over the vertices and completes before the next one starts.
 */
public class WeisfeilerLehmanRelabeler {
    private static final Logger logger = LoggerFactory.getLogger(WeisfeilerLehmanRelabeler.class);

    public static final String SEPARATOR = "-";

    private final int wlIterations;
    private final int threads;
    private final ForkJoinPool forkJoinPool;

    public WeisfeilerLehmanRelabeler(int wlIterations) {
        this(wlIterations, 1, ForkJoinPool.commonPool());
    }

    public WeisfeilerLehmanRelabeler(int wlIterations, int threads, ForkJoinPool forkJoinPool) {
        Validate.isTrue(wlIterations >= 0, "wlIterations must not be negative: %d", wlIterations);
        Validate.isTrue(threads > 0, "threads must be positive: %d", threads);
        this.wlIterations = wlIterations;
        this.threads = threads;
        this.forkJoinPool = Validate.notNull(forkJoinPool, "forkJoinPool must not be null");
    }

    public LabelMap relabel(GraphAccessor graph) {
        long tStart = System.currentTimeMillis();

        Collection<Vertex> all = graph.allVertices();
        Vertex[] vertices = all.toArray(new Vertex[0]);
        VertexIndex index = new VertexIndex(vertices);

        int[][] inverse = inverseNeighbors(graph, vertices, index);

        String[][] labels = new String[wlIterations + 1][];
        labels[0] = new String[vertices.length];
        for (int pos = 0; pos < vertices.length; pos++)
            labels[0][pos] = vertices[pos].getName();

        for (int n = 1; n <= wlIterations; n++) {
            long tRound = System.currentTimeMillis();
            final String[] previous = labels[n - 1];
            final String[] current = new String[vertices.length];
            MultiCoreUtils.forEachBatch(forkJoinPool, threads, vertices.length, MultiCoreUtils.BATCH_SIZE,
                    (thread, start, end) -> {
                        for (int pos = start; pos < end; pos++)
                            current[pos] = LabelDigest.digest(createLabel(previous, inverse[pos], pos));
                    });
            labels[n] = current;
            logger.debug("WL round {} relabeled {} vertices, duration: {} ms",
                    n, vertices.length, System.currentTimeMillis() - tRound);
        }

        logger.info("WL relabeling of {} vertices with {} iterations, duration: {} ms",
                vertices.length, wlIterations, System.currentTimeMillis() - tStart);
        return new LabelMap(index, labels);
    }

    /**
     * Builds the multi-set label of a vertex out of the previous round: own label, separator and
     * the sorted distinct labels of the inverse neighbors.
     */
    static String createLabel(String[] previous, int[] inverseNeighbors, int pos) {
        TreeSet<String> neighborLabels = new TreeSet<>();
        for (int neighbor : inverseNeighbors)
            neighborLabels.add(previous[neighbor]);
        return previous[pos] + SEPARATOR + StringUtils.join(neighborLabels, SEPARATOR);
    }

    private static int[][] inverseNeighbors(GraphAccessor graph, Vertex[] vertices,
                                            VertexIndex index) {
        int[][] inverse = new int[vertices.length][];
        IntArrayList list = new IntArrayList();
        for (int pos = 0; pos < vertices.length; pos++) {
            list.clear();
            for (Vertex neighbor : graph.inverseNeighbors(vertices[pos])) {
                int neighborPos = index.position(neighbor);
                if (neighborPos < 0) {
                    logger.warn("Inverse neighbor {} of {} is not a vertex of the graph, ignored",
                            neighbor, vertices[pos]);
                    continue;
                }
                list.add(neighborPos);
            }
            inverse[pos] = list.toIntArray();
        }
        return inverse;
    }

    public int getWlIterations() {
        return wlIterations;
    }
}
