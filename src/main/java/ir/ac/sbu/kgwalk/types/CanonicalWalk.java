package ir.ac.sbu.kgwalk.types;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A walk encoded as strings. Even positions hold vertex names and odd positions hold the label
 * of the vertex at that hop for one relabeling round.
 */
public final class CanonicalWalk {

    private final String[] tokens;

    public CanonicalWalk(String... tokens) {
        this.tokens = tokens.clone();
    }

    public String get(int index) {
        return tokens[index];
    }

    public int size() {
        return tokens.length;
    }

    public List<String> getTokens() {
        return Collections.unmodifiableList(Arrays.asList(tokens));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof CanonicalWalk))
            return false;
        return Arrays.equals(tokens, ((CanonicalWalk) obj).tokens);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(tokens);
    }

    /**
     * @return the tokens separated by a single space, the sentence form word-vector trainers read
     */
    @Override
    public String toString() {
        return StringUtils.join(tokens, ' ');
    }
}
