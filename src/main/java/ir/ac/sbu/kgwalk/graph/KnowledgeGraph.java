package ir.ac.sbu.kgwalk.graph;

import ir.ac.sbu.kgwalk.types.Vertex;
import ir.ac.sbu.kgwalk.types.VertexFactory;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * In memory knowledge graph built triple by triple. Entities are interned by name; every triple
 * gets its own predicate vertex sitting between subject and object.
 * <p>
 * Neighbors are returned in insertion order. The graph is not thread safe for writes.
 */
public class KnowledgeGraph implements GraphAccessor {
    private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraph.class);

    private final VertexFactory vertexFactory;
    private final Int2ObjectOpenHashMap<Vertex> registry;
    private final Map<String, Vertex> entities;
    private final Map<Vertex, Set<Vertex>> transitionMatrix;
    private final Map<Vertex, Set<Vertex>> invTransitionMatrix;
    private int edgeCount;

    public KnowledgeGraph() {
        this(new VertexFactory());
    }

    public KnowledgeGraph(VertexFactory vertexFactory) {
        this.vertexFactory = vertexFactory;
        registry = new Int2ObjectOpenHashMap<>();
        entities = new HashMap<>();
        transitionMatrix = new LinkedHashMap<>();
        invTransitionMatrix = new HashMap<>();
    }

    /**
     * Returns the entity with the given name, creating and adding it if it does not exist yet.
     */
    public Vertex addEntity(String name) {
        Vertex entity = entities.get(name);
        if (entity == null) {
            entity = vertexFactory.create(name);
            addVertex(entity);
        }
        return entity;
    }

    public void addVertex(Vertex vertex) {
        Validate.notNull(vertex, "vertex must not be null");
        if (transitionMatrix.containsKey(vertex))
            return;

        registry.put(vertex.getId(), vertex);
        if (!vertex.isPredicate())
            entities.putIfAbsent(vertex.getName(), vertex);
        transitionMatrix.put(vertex, new LinkedHashSet<>());
        invTransitionMatrix.put(vertex, new LinkedHashSet<>());
    }

    /**
     * Adds a directed edge, adding the end points first when they are not in the graph yet.
     */
    public void addEdge(Vertex from, Vertex to) {
        addVertex(from);
        addVertex(to);
        if (transitionMatrix.get(from).add(to)) {
            invTransitionMatrix.get(to).add(from);
            edgeCount++;
        }
    }

    /**
     * @return true if the edge existed
     */
    public boolean removeEdge(Vertex from, Vertex to) {
        Set<Vertex> out = transitionMatrix.get(from);
        if (out == null || !out.remove(to))
            return false;

        invTransitionMatrix.get(to).remove(from);
        edgeCount--;
        return true;
    }

    /**
     * Adds the statement subject-predicate-object and returns the predicate vertex created for it.
     */
    public Vertex addTriple(String subject, String predicate, String object) {
        Vertex s = addEntity(subject);
        Vertex o = addEntity(object);
        Vertex p = vertexFactory.createPredicate(predicate, s, o);
        addEdge(s, p);
        addEdge(p, o);
        logger.trace("Triple added: {} {} {}", s, p, o);
        return p;
    }

    public Vertex entity(String name) {
        return entities.get(name);
    }

    /**
     * @return the subject of a predicate vertex, null for entities
     */
    public Vertex previous(Vertex predicate) {
        return vertex(predicate.getPreviousId());
    }

    /**
     * @return the object of a predicate vertex, null for entities
     */
    public Vertex next(Vertex predicate) {
        return vertex(predicate.getNextId());
    }

    @Override
    public Collection<Vertex> allVertices() {
        return Collections.unmodifiableSet(transitionMatrix.keySet());
    }

    @Override
    public Collection<Vertex> neighbors(Vertex vertex) {
        Set<Vertex> out = transitionMatrix.get(vertex);
        return out == null ? Collections.emptySet() : Collections.unmodifiableSet(out);
    }

    @Override
    public Collection<Vertex> inverseNeighbors(Vertex vertex) {
        Set<Vertex> in = invTransitionMatrix.get(vertex);
        return in == null ? Collections.emptySet() : Collections.unmodifiableSet(in);
    }

    @Override
    public boolean contains(Vertex vertex) {
        return vertex != null && transitionMatrix.containsKey(vertex);
    }

    @Override
    public Vertex vertex(int id) {
        return registry.get(id);
    }

    /**
     * @return the factory which created the vertices of this graph
     */
    public VertexFactory getVertexFactory() {
        return vertexFactory;
    }

    public int vertexCount() {
        return transitionMatrix.size();
    }

    public int edgeCount() {
        return edgeCount;
    }
}
