package com.github.tarcv.u4jautomaton;

import java.util.Arrays;

/**
 * Outcome of one matching operation. Offsets count code points, not UTF-16 units.
 * Groups that did not take part in the match report -1 and null.
 */
public final class MatchResult {
    public static final MatchResult NO_MATCH = new MatchResult(null, null);

    private final int[] input;
    private final int[] groups;

    MatchResult(final int[] input, final int[] groups) {
        this.input = input;
        this.groups = groups;
    }

    public boolean isMatch() {
        return groups != null;
    }

    private void checkMatch() {
        if (groups == null) {
            throw new IllegalStateException("No match");
        }
    }

    private void checkGroup(final int group) {
        checkMatch();
        if (group < 0 || 2 * group >= groups.length) {
            throw new IndexOutOfBoundsException("No group " + group);
        }
    }

    /**
     * Number of capture groups in the pattern, not counting group 0.
     */
    public int groupCount() {
        return groups == null ? 0 : groups.length / 2 - 1;
    }

    public int start() {
        return start(0);
    }

    public int end() {
        return end(0);
    }

    public int start(final int group) {
        checkGroup(group);
        return groups[2 * group];
    }

    public int end(final int group) {
        checkGroup(group);
        return groups[2 * group + 1];
    }

    public String group() {
        return group(0);
    }

    public String group(final int group) {
        checkGroup(group);
        int s = groups[2 * group];
        if (s < 0) {
            return null;
        }
        return Util.fromCodePoints(input, s, groups[2 * group + 1]);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatchResult)) {
            return false;
        }
        return Arrays.equals(groups, ((MatchResult) o).groups) && Arrays.equals(input, ((MatchResult) o).input);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(input) + Arrays.hashCode(groups);
    }

    @Override
    public String toString() {
        if (groups == null) {
            return "MatchResult{NO_MATCH}";
        }
        StringBuilder sb = new StringBuilder("MatchResult{");
        for (int g = 0; 2 * g < groups.length; g++) {
            if (g > 0) {
                sb.append(", ");
            }
            sb.append(g).append("=[").append(groups[2 * g]).append(',').append(groups[2 * g + 1]).append(')');
        }
        return sb.append('}').toString();
    }
}
