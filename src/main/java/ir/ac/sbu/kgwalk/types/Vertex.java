package ir.ac.sbu.kgwalk.types;

import java.util.Objects;

/**
 * Encapsulate a vertex of a knowledge graph.
 * <p>
 * An entity vertex is identified by its name only, so two entity vertices with the same name are
 * equal whatever their ids. A predicate vertex stands for one occurrence of a relation between a
 * subject and an object, and equals only a vertex carrying the same id, the same neighbours and
 * the same name.
 * <p>
 * Equality is decided by the receiver: an entity equals any vertex with its name, a predicate
 * included, while that predicate does not equal the entity. The two kinds must not share an
 * equality based hash structure when their names can collide; key entities by name and
 * predicates by id instead.
 * <p>
 * The natural order compares names only. It is not consistent with {@link #equals(Object)} for
 * predicate vertices.
 * <p>
 * Instances are created through a {@link VertexFactory}.
 */
public final class Vertex implements Comparable<Vertex> {

    public static final int NO_VERTEX = -1;

    private final int id;
    private final String name;
    private final boolean predicate;
    private final int previousId;
    private final int nextId;

    Vertex(int id, String name, boolean predicate, int previousId, int nextId) {
        this.id = id;
        this.name = name;
        this.predicate = predicate;
        this.previousId = previousId;
        this.nextId = nextId;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isPredicate() {
        return predicate;
    }

    /**
     * @return id of the subject before this predicate, {@link #NO_VERTEX} if there is none
     */
    public int getPreviousId() {
        return previousId;
    }

    /**
     * @return id of the object after this predicate, {@link #NO_VERTEX} if there is none
     */
    public int getNextId() {
        return nextId;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Vertex))
            return false;

        Vertex other = (Vertex) obj;
        if (predicate)
            return id == other.id && previousId == other.previousId && nextId == other.nextId &&
                    name.equals(other.name);
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        if (predicate)
            return Objects.hash(id, previousId, nextId, name);
        return name.hashCode();
    }

    @Override
    public int compareTo(Vertex other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
