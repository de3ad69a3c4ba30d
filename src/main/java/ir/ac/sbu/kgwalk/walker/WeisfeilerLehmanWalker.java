package ir.ac.sbu.kgwalk.walker;

import ir.ac.sbu.kgwalk.graph.GraphAccessor;
import ir.ac.sbu.kgwalk.types.CanonicalWalk;
import ir.ac.sbu.kgwalk.types.Vertex;
import ir.ac.sbu.kgwalk.types.VertexFactory;
import ir.ac.sbu.kgwalk.types.Walk;
import ir.ac.sbu.kgwalk.utils.MultiCoreUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ForkJoinPool;

/**
 * Extracts Weisfeiler-Lehman walks rooted at a set of instances. The graph is relabeled once,
 * then every instance gets its random walks encoded once per relabeling round. The output set is
 * what an embedding trainer consumes as its corpus.
 */
public class WeisfeilerLehmanWalker implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(WeisfeilerLehmanWalker.class);

    private static final int INSTANCE_BATCH_SIZE = 16;

    private final WalkerConf conf;
    private final ForkJoinPool forkJoinPool;
    private final RandomWalkExtractor extractor;
    private final WeisfeilerLehmanRelabeler relabeler;
    // root lookups only, entities match graph vertices by name
    private final VertexFactory rootFactory;
    private volatile LabelMap labelMap;

    public WeisfeilerLehmanWalker(WalkerConf conf) {
        this.conf = conf;
        forkJoinPool = new ForkJoinPool(conf.getThreads());
        extractor = new RandomWalkExtractor(conf.getDepth(), conf.getWalksPerGraph(), conf.getSeed());
        relabeler = new WeisfeilerLehmanRelabeler(conf.getWlIterations(), conf.getThreads(), forkJoinPool);
        rootFactory = new VertexFactory();
    }

    /**
     * @param graph     graph to walk, it must not change during the call
     * @param instances names of the root entities
     * @return the distinct canonical walks of all instances and rounds
     */
    public Set<CanonicalWalk> extract(GraphAccessor graph, Collection<String> instances) {
        long tStart = System.currentTimeMillis();
        LabelMap labels = relabeler.relabel(graph);
        labelMap = labels;
        CanonicalWalkBuilder builder = new CanonicalWalkBuilder(labels);

        List<Vertex> roots = new ArrayList<>(instances.size());
        for (String instance : instances)
            roots.add(rootFactory.create(instance));

        int threads = conf.getThreads();
        List<Set<CanonicalWalk>> outputs = new ArrayList<>(threads);
        for (int i = 0; i < threads; i++)
            outputs.add(new HashSet<>());

        MultiCoreUtils.forEachBatch(forkJoinPool, threads, roots.size(), INSTANCE_BATCH_SIZE,
                (thread, start, end) -> {
                    Set<CanonicalWalk> output = outputs.get(thread);
                    for (int i = start; i < end; i++) {
                        List<Walk> walks = extractor.extractWalks(graph, roots.get(i));
                        builder.addWalks(walks, output);
                    }
                });

        Set<CanonicalWalk> canonicalWalks = outputs.get(0);
        for (int i = 1; i < threads; i++)
            canonicalWalks.addAll(outputs.get(i));

        logger.info("Extracted {} canonical walks for {} instances, duration: {} ms",
                canonicalWalks.size(), roots.size(), System.currentTimeMillis() - tStart);
        return canonicalWalks;
    }

    /**
     * @return labels computed by the last extraction, null before the first one
     */
    public LabelMap getLabelMap() {
        return labelMap;
    }

    public WalkerConf getConf() {
        return conf;
    }

    @Override
    public void close() {
        forkJoinPool.shutdown();
    }
}
