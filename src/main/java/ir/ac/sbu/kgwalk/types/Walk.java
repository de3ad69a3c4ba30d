package ir.ac.sbu.kgwalk.types;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An immutable path through the graph starting at its root: entity, predicate, entity, ...
 */
public final class Walk {

    private final Vertex[] hops;

    private Walk(Vertex[] hops) {
        this.hops = hops;
    }

    public static Walk of(Vertex root) {
        return new Walk(new Vertex[]{root});
    }

    /**
     * @return a new walk which continues this one with the given predicate and object
     */
    public Walk extend(Vertex predicate, Vertex object) {
        Vertex[] extended = Arrays.copyOf(hops, hops.length + 2);
        extended[hops.length] = predicate;
        extended[hops.length + 1] = object;
        return new Walk(extended);
    }

    public Vertex getRoot() {
        return hops[0];
    }

    public Vertex getLast() {
        return hops[hops.length - 1];
    }

    public Vertex get(int index) {
        return hops[index];
    }

    public int length() {
        return hops.length;
    }

    public List<Vertex> getHops() {
        return Collections.unmodifiableList(Arrays.asList(hops));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Walk))
            return false;
        return Arrays.equals(hops, ((Walk) obj).hops);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(hops);
    }

    @Override
    public String toString() {
        return Arrays.toString(hops);
    }
}
