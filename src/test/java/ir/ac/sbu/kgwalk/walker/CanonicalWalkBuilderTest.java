package ir.ac.sbu.kgwalk.walker;

import ir.ac.sbu.kgwalk.graph.KnowledgeGraph;
import ir.ac.sbu.kgwalk.types.CanonicalWalk;
import ir.ac.sbu.kgwalk.types.Vertex;
import ir.ac.sbu.kgwalk.types.Walk;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CanonicalWalkBuilderTest {

    @Test
    public void testNamesAtEvenLabelsAtOddPositions() {
        KnowledgeGraph graph = GraphFixtures.chain();
        Vertex a = graph.entity("A");
        Vertex b = graph.entity("B");
        Vertex c = graph.entity("C");
        Vertex p = graph.neighbors(a).iterator().next();
        Vertex q = graph.neighbors(b).iterator().next();
        LabelMap labels = new WeisfeilerLehmanRelabeler(2).relabel(graph);
        CanonicalWalkBuilder builder = new CanonicalWalkBuilder(labels);

        Walk walk = Walk.of(a).extend(p, b).extend(q, c);

        assertEquals(new CanonicalWalk("A", "p", "B", "q", "C"), builder.canonicalize(walk, 0));
        CanonicalWalk second = builder.canonicalize(walk, 2);
        assertEquals(new CanonicalWalk("A", labels.label(p, 2), "B", labels.label(q, 2), "C"), second);
    }

    @Test
    public void testOneCanonicalWalkPerRound() {
        KnowledgeGraph graph = GraphFixtures.chain();
        Vertex a = graph.entity("A");
        Vertex p = graph.neighbors(a).iterator().next();
        LabelMap labels = new WeisfeilerLehmanRelabeler(3).relabel(graph);
        CanonicalWalkBuilder builder = new CanonicalWalkBuilder(labels);

        Set<CanonicalWalk> output = new HashSet<>();
        Walk walk = Walk.of(a).extend(p, graph.entity("B"));
        assertEquals(4, builder.addWalks(Collections.singletonList(walk), output));
        assertEquals(4, output.size());

        // adding the same walk again yields nothing new
        assertEquals(0, builder.addWalks(Arrays.asList(walk, walk), output));
        assertEquals(4, output.size());
    }

    @Test
    public void testTrivialWalk() {
        KnowledgeGraph graph = GraphFixtures.chain();
        LabelMap labels = new WeisfeilerLehmanRelabeler(2).relabel(graph);
        CanonicalWalkBuilder builder = new CanonicalWalkBuilder(labels);

        Set<CanonicalWalk> output = new HashSet<>();
        builder.addWalks(Collections.singletonList(Walk.of(graph.entity("C"))), output);

        // the root name is the same in every round
        assertEquals(Collections.singleton(new CanonicalWalk("C")), output);
    }

    @Test
    public void testVertexMissingFromLabelsKeepsName() {
        KnowledgeGraph graph = GraphFixtures.chain();
        LabelMap labels = new WeisfeilerLehmanRelabeler(1).relabel(graph);
        Vertex a = graph.entity("A");
        Vertex extra = graph.getVertexFactory().createPredicate("extra", a, null);

        CanonicalWalk walk = new CanonicalWalkBuilder(labels).canonicalize(
                Walk.of(a).extend(extra, graph.entity("C")), 1);

        assertEquals("extra", walk.get(1));
        assertTrue(walk.getTokens().contains("C"));
    }
}
