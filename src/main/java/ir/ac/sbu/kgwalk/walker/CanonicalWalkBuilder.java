package ir.ac.sbu.kgwalk.walker;

import ir.ac.sbu.kgwalk.types.CanonicalWalk;
import ir.ac.sbu.kgwalk.types.Vertex;
import ir.ac.sbu.kgwalk.types.Walk;

import java.util.Collection;
import java.util.Set;

/**
 * Turns raw walks into canonical walks, one per relabeling round.
 */
public class CanonicalWalkBuilder {

    private final LabelMap labelMap;

    public CanonicalWalkBuilder(LabelMap labelMap) {
        this.labelMap = labelMap;
    }

    /**
     * Vertex names go to even positions and round labels to odd positions. A vertex unknown to the
     * label map keeps its name.
     */
    public CanonicalWalk canonicalize(Walk walk, int round) {
        String[] tokens = new String[walk.length()];
        for (int i = 0; i < tokens.length; i++) {
            Vertex hop = walk.get(i);
            if (i % 2 == 0) {
                tokens[i] = hop.getName();
            } else {
                String label = labelMap.label(hop, round);
                tokens[i] = label == null ? hop.getName() : label;
            }
        }
        return new CanonicalWalk(tokens);
    }

    /**
     * Adds the canonical form of every walk for every round from 0 to wlIterations.
     *
     * @return number of canonical walks not already in the output
     */
    public int addWalks(Collection<Walk> walks, Set<CanonicalWalk> output) {
        int added = 0;
        for (int round = 0; round <= labelMap.getWlIterations(); round++) {
            for (Walk walk : walks) {
                if (output.add(canonicalize(walk, round)))
                    added++;
            }
        }
        return added;
    }
}
