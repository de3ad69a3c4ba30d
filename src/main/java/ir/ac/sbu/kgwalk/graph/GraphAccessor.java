package ir.ac.sbu.kgwalk.graph;

import ir.ac.sbu.kgwalk.types.Vertex;

import java.util.Collection;

/**
 * Read access to a knowledge graph. Walk extraction and relabeling never modify the graph and
 * expect it to stay unchanged while they run.
 */
public interface GraphAccessor {

    Collection<Vertex> allVertices();

    /**
     * @return the vertices reached by the outgoing edges of the vertex, empty if the vertex is
     * not in the graph
     */
    Collection<Vertex> neighbors(Vertex vertex);

    /**
     * @return the vertices having an edge to the vertex, empty if the vertex is not in the graph
     */
    Collection<Vertex> inverseNeighbors(Vertex vertex);

    boolean contains(Vertex vertex);

    /**
     * @return the vertex registered with the given id or null
     */
    Vertex vertex(int id);
}
