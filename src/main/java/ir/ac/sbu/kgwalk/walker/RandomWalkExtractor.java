package ir.ac.sbu.kgwalk.walker;

import ir.ac.sbu.kgwalk.graph.GraphAccessor;
import ir.ac.sbu.kgwalk.types.Vertex;
import ir.ac.sbu.kgwalk.types.Walk;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Extracts walks of at most depth hops from a root vertex. A hop is a predicate followed by an
 * entity, so a walk holds up to 2 * depth + 1 vertices.
 * <p>
 * Walks are expanded breadth first. Whenever more than walksPerGraph walks are alive after a hop,
 * walksPerGraph of them are kept, drawn uniformly among the walks of that hop. Pruning per hop
 * means the final walks are not a uniform sample of all full length walks: walks below a prefix
 * with little fan out are kept more often. The sample is drawn from a generator seeded per root,
 * so the same graph, root and seed always give the same walks.
 */
public class RandomWalkExtractor {
    private static final Logger logger = LoggerFactory.getLogger(RandomWalkExtractor.class);

    private final int depth;
    private final int walksPerGraph;
    private final long seed;

    public RandomWalkExtractor(int depth, int walksPerGraph, long seed) {
        Validate.isTrue(depth > 0, "depth must be positive: %d", depth);
        Validate.isTrue(walksPerGraph > 0, "walksPerGraph must be positive: %d", walksPerGraph);
        this.depth = depth;
        this.walksPerGraph = walksPerGraph;
        this.seed = seed;
    }

    /**
     * @return distinct walks starting at root, empty if root is not in the graph
     */
    public List<Walk> extractWalks(GraphAccessor graph, Vertex root) {
        if (!graph.contains(root)) {
            logger.debug("Root {} is not in the graph, no walks extracted", root);
            return Collections.emptyList();
        }

        Random random = new Random(seed ^ root.getName().hashCode());
        List<Walk> walks = new ArrayList<>();
        walks.add(Walk.of(root));

        for (int d = 0; d < depth; d++) {
            Set<Walk> extended = new LinkedHashSet<>();
            boolean grown = false;
            for (Walk walk : walks) {
                List<Walk> next = hops(graph, walk);
                if (next.isEmpty()) {
                    extended.add(walk);
                } else {
                    extended.addAll(next);
                    grown = true;
                }
            }

            walks = sample(new ArrayList<>(extended), random);
            if (!grown)
                break;
        }

        logger.trace("Root {}, walks: {}", root, walks.size());
        return walks;
    }

    private static List<Walk> hops(GraphAccessor graph, Walk walk) {
        List<Walk> next = new ArrayList<>();
        Collection<Vertex> predicates = graph.neighbors(walk.getLast());
        for (Vertex predicate : predicates) {
            for (Vertex object : graph.neighbors(predicate))
                next.add(walk.extend(predicate, object));
        }
        return next;
    }

    /**
     * Keeps walksPerGraph walks picked uniformly without replacement, preserving their order.
     */
    private List<Walk> sample(List<Walk> walks, Random random) {
        if (walks.size() <= walksPerGraph)
            return walks;

        // partial Fisher-Yates over positions
        int[] positions = new int[walks.size()];
        for (int i = 0; i < positions.length; i++)
            positions[i] = i;
        for (int i = 0; i < walksPerGraph; i++) {
            int j = i + random.nextInt(positions.length - i);
            int temp = positions[i];
            positions[i] = positions[j];
            positions[j] = temp;
        }

        boolean[] kept = new boolean[walks.size()];
        for (int i = 0; i < walksPerGraph; i++)
            kept[positions[i]] = true;

        List<Walk> sampled = new ArrayList<>(walksPerGraph);
        for (int i = 0; i < kept.length; i++) {
            if (kept[i])
                sampled.add(walks.get(i));
        }
        return sampled;
    }

    public int getDepth() {
        return depth;
    }

    public int getWalksPerGraph() {
        return walksPerGraph;
    }
}
