package ir.ac.sbu.kgwalk.walker;

import ir.ac.sbu.kgwalk.types.Vertex;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Labels of every vertex of a graph for the relabeling rounds 0 to wlIterations. Round 0 holds
 * vertex names. Immutable once built.
 */
public class LabelMap {

    private final VertexIndex index;
    // labels[round][vertex position]
    private final String[][] labels;

    LabelMap(VertexIndex index, String[][] labels) {
        this.index = index;
        this.labels = labels;
    }

    public int getWlIterations() {
        return labels.length - 1;
    }

    public int size() {
        return index.size();
    }

    public boolean contains(Vertex vertex) {
        return index.contains(vertex);
    }

    /**
     * @return the label of the vertex at the given round or null if the vertex was not relabeled
     */
    public String label(Vertex vertex, int round) {
        Validate.inclusiveBetween(0, getWlIterations(), round);
        int pos = index.position(vertex);
        if (pos < 0)
            return null;
        return labels[round][pos];
    }

    /**
     * @return labels of the vertex ordered by round, empty if the vertex was not relabeled
     */
    public List<String> labels(Vertex vertex) {
        int pos = index.position(vertex);
        if (pos < 0)
            return Collections.emptyList();

        List<String> result = new ArrayList<>(labels.length);
        for (String[] round : labels)
            result.add(round[pos]);
        return result;
    }

    /**
     * Builds the reverse lookup from label to round for one vertex. When a label occurs in more
     * than one round the latest round is kept.
     */
    public Object2IntMap<String> inverseLabels(Vertex vertex) {
        Object2IntOpenHashMap<String> inverse = new Object2IntOpenHashMap<>(labels.length);
        inverse.defaultReturnValue(-1);
        int pos = index.position(vertex);
        if (pos < 0)
            return inverse;

        for (int round = 0; round < labels.length; round++)
            inverse.put(labels[round][pos], round);
        return inverse;
    }

    /**
     * @return the round in which the vertex carried the label, -1 if it never did
     */
    public int round(Vertex vertex, String label) {
        return inverseLabels(vertex).getInt(label);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof LabelMap))
            return false;

        LabelMap other = (LabelMap) obj;
        if (labels.length != other.labels.length || index.size() != other.index.size())
            return false;

        for (int pos = 0; pos < index.size(); pos++) {
            int otherPos = other.index.position(index.vertex(pos));
            if (otherPos < 0)
                return false;
            for (int round = 0; round < labels.length; round++) {
                if (!labels[round][pos].equals(other.labels[round][otherPos]))
                    return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = labels.length;
        for (int pos = 0; pos < index.size(); pos++) {
            String[] column = new String[labels.length];
            for (int round = 0; round < labels.length; round++)
                column[round] = labels[round][pos];
            hash += index.vertex(pos).hashCode() ^ Arrays.hashCode(column);
        }
        return hash;
    }
}
