package ir.ac.sbu.kgwalk.types;

import org.apache.commons.lang3.Validate;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates vertices and hands out their ids. Ids are unique and increasing within one factory, so
 * each graph owns its own factory.
 */
public class VertexFactory {

    private final AtomicInteger idGenerator;

    public VertexFactory() {
        this(0);
    }

    public VertexFactory(int firstId) {
        Validate.isTrue(firstId >= 0, "first vertex id must not be negative: %d", firstId);
        idGenerator = new AtomicInteger(firstId);
    }

    public Vertex create(String name) {
        return create(name, false, null, null);
    }

    public Vertex createPredicate(String name, Vertex previous, Vertex next) {
        return create(name, true, previous, next);
    }

    public Vertex create(String name, boolean predicate, Vertex previous, Vertex next) {
        Validate.notNull(name, "vertex name must not be null");
        if (!predicate)
            Validate.isTrue(previous == null && next == null,
                    "entity vertex %s cannot have previous or next vertices", name);

        int previousId = previous == null ? Vertex.NO_VERTEX : previous.getId();
        int nextId = next == null ? Vertex.NO_VERTEX : next.getId();
        return new Vertex(idGenerator.getAndIncrement(), name, predicate, previousId, nextId);
    }

    /**
     * @return the id the next created vertex will receive
     */
    public int peekNextId() {
        return idGenerator.get();
    }
}
