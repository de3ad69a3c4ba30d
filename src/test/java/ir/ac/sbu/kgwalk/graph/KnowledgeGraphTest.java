package ir.ac.sbu.kgwalk.graph;

import ir.ac.sbu.kgwalk.types.Vertex;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class KnowledgeGraphTest {

    private KnowledgeGraph graph;

    @Before
    public void setUp() {
        graph = new KnowledgeGraph();
    }

    @Test
    public void testTripleWiresPredicateBetweenEntities() {
        Vertex p = graph.addTriple("A", "p", "B");
        Vertex a = graph.entity("A");
        Vertex b = graph.entity("B");

        assertEquals(3, graph.vertexCount());
        assertEquals(2, graph.edgeCount());
        assertEquals(Collections.singletonList(p), new ArrayList<>(graph.neighbors(a)));
        assertEquals(Collections.singletonList(b), new ArrayList<>(graph.neighbors(p)));
        assertEquals(Collections.singletonList(a), new ArrayList<>(graph.inverseNeighbors(p)));
        assertEquals(Collections.singletonList(p), new ArrayList<>(graph.inverseNeighbors(b)));
        assertSame(a, graph.previous(p));
        assertSame(b, graph.next(p));
        assertNull(graph.previous(a));
    }

    @Test
    public void testEntitiesAreInterned() {
        Vertex p = graph.addTriple("A", "p", "B");
        Vertex q = graph.addTriple("A", "p", "C");

        assertEquals(5, graph.vertexCount());
        assertEquals(Arrays.asList(p, q), new ArrayList<>(graph.neighbors(graph.entity("A"))));
        // another vertex object with the same entity name finds the same neighbors
        Vertex lookup = graph.getVertexFactory().create("A");
        assertTrue(graph.contains(lookup));
        assertEquals(2, graph.neighbors(lookup).size());
    }

    @Test
    public void testUnknownVertex() {
        graph.addTriple("A", "p", "B");
        Vertex unknown = graph.getVertexFactory().create("Z");

        assertFalse(graph.contains(unknown));
        assertFalse(graph.contains(null));
        assertTrue(graph.neighbors(unknown).isEmpty());
        assertTrue(graph.inverseNeighbors(unknown).isEmpty());
        assertNull(graph.entity("Z"));
        assertNull(graph.vertex(Vertex.NO_VERTEX));
    }

    @Test
    public void testRemoveEdge() {
        Vertex p = graph.addTriple("A", "p", "B");
        Vertex b = graph.entity("B");

        assertTrue(graph.removeEdge(p, b));
        assertFalse(graph.removeEdge(p, b));
        assertEquals(1, graph.edgeCount());
        assertTrue(graph.neighbors(p).isEmpty());
        assertTrue(graph.inverseNeighbors(b).isEmpty());
        assertTrue(graph.contains(b));
    }

    @Test
    public void testRegistryLookup() {
        Vertex p = graph.addTriple("A", "p", "B");
        assertSame(p, graph.vertex(p.getId()));
        assertSame(graph.entity("A"), graph.vertex(p.getPreviousId()));
    }
}
