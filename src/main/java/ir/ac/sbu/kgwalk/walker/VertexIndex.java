package ir.ac.sbu.kgwalk.walker;

import ir.ac.sbu.kgwalk.types.Vertex;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Position of every vertex of a relabeled graph. Entities are keyed by name and predicates by id
 * in separate maps, so an entity never resolves to a predicate of the same name or the other way
 * round.
 */
final class VertexIndex {

    private final Vertex[] vertices;
    private final Object2IntOpenHashMap<String> entities;
    private final Int2IntOpenHashMap predicates;

    VertexIndex(Vertex[] vertices) {
        this.vertices = vertices;
        entities = new Object2IntOpenHashMap<>();
        entities.defaultReturnValue(-1);
        predicates = new Int2IntOpenHashMap();
        predicates.defaultReturnValue(-1);
        for (int pos = 0; pos < vertices.length; pos++) {
            Vertex vertex = vertices[pos];
            if (vertex.isPredicate())
                predicates.putIfAbsent(vertex.getId(), pos);
            else
                entities.putIfAbsent(vertex.getName(), pos);
        }
    }

    /**
     * @return position of the vertex, -1 if it is not indexed
     */
    int position(Vertex vertex) {
        if (!vertex.isPredicate())
            return entities.getInt(vertex.getName());

        int pos = predicates.get(vertex.getId());
        if (pos < 0 || !vertex.equals(vertices[pos]))
            return -1;
        return pos;
    }

    boolean contains(Vertex vertex) {
        return position(vertex) >= 0;
    }

    Vertex vertex(int pos) {
        return vertices[pos];
    }

    int size() {
        return vertices.length;
    }
}
