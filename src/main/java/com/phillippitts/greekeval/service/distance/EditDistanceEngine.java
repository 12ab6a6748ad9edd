package com.phillippitts.greekeval.service.distance;

import com.phillippitts.greekeval.domain.AlignedPair;
import com.phillippitts.greekeval.domain.EditOperation;
import com.phillippitts.greekeval.domain.EditOperationCounts;
import com.phillippitts.greekeval.domain.WordAlignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Unit-cost Levenshtein distance over token sequences (words or characters).
 *
 * <p>Three entry points share one recurrence:
 * <ul>
 *   <li>{@link #distance(List, List)} - distance only, single-row DP in O(min(|a|,|b|)) memory</li>
 *   <li>{@link #distanceDetailed(List, List)} - distance decomposed into substitutions,
 *       deletions and insertions along one optimal path</li>
 *   <li>{@link #align(List, List)} - the optimal path itself as a {@link WordAlignment}</li>
 * </ul>
 *
 * <p><b>Tie-break:</b> when several predecessors reach a cell at the same cost the step is chosen
 * in the order match, substitution, deletion, insertion. {@code distanceDetailed} and
 * {@code align} use the same rule, so the counts always describe the returned alignment.
 *
 * <p>The first argument is the reference: a token present only there is a deletion, a token
 * present only in the second argument is an insertion. Tokens are compared with
 * {@link Objects#equals(Object, Object)}.
 *
 * <p>Thread-safe: stateless, every call allocates its own tables. Total over all finite inputs.
 *
 * @since 1.0
 */
public final class EditDistanceEngine {

    /**
     * Computes the edit distance between two token sequences.
     *
     * @param a   first sequence (may be null, treated as empty)
     * @param b   second sequence (may be null, treated as empty)
     * @param <T> token type
     * @return minimum number of unit-cost edits
     */
    public <T> int distance(List<T> a, List<T> b) {
        List<T> longer = a == null ? List.of() : a;
        List<T> shorter = b == null ? List.of() : b;
        if (longer.size() < shorter.size()) {
            List<T> tmp = longer;
            longer = shorter;
            shorter = tmp;
        }
        if (shorter.isEmpty()) {
            return longer.size();
        }

        // Row width follows the shorter sequence
        int width = shorter.size();
        int[] previous = new int[width + 1];
        int[] current = new int[width + 1];
        for (int j = 0; j <= width; j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= longer.size(); i++) {
            current[0] = i;
            T token = longer.get(i - 1);
            for (int j = 1; j <= width; j++) {
                int substitution = previous[j - 1] + (Objects.equals(token, shorter.get(j - 1)) ? 0 : 1);
                int deletion = previous[j] + 1;
                int insertion = current[j - 1] + 1;
                current[j] = Math.min(substitution, Math.min(deletion, insertion));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[width];
    }

    /**
     * Computes the edit distance together with its operation breakdown.
     *
     * <p>Alongside the cost table, three count tables accumulate the operations of the path
     * reaching each cell: every cell inherits the counts of the predecessor chosen by the
     * tie-break rule and increments the counter of that step (matches add nothing).
     *
     * @param reference  reference sequence (may be null)
     * @param hypothesis hypothesis sequence (may be null)
     * @param <T>        token type
     * @return operation counts whose sum equals {@link #distance(List, List)}
     */
    public <T> EditOperationCounts distanceDetailed(List<T> reference, List<T> hypothesis) {
        List<T> ref = reference == null ? List.of() : reference;
        List<T> hyp = hypothesis == null ? List.of() : hypothesis;
        int n = ref.size();
        int m = hyp.size();

        int[][] cost = costTable(ref, hyp);
        int[][] subs = new int[n + 1][m + 1];
        int[][] dels = new int[n + 1][m + 1];
        int[][] ins = new int[n + 1][m + 1];

        for (int i = 0; i <= n; i++) {
            for (int j = 0; j <= m; j++) {
                if (i == 0 && j == 0) {
                    continue;
                }
                EditOperation step = chooseStep(cost, ref, hyp, i, j);
                int pi = step == EditOperation.INSERTION ? i : i - 1;
                int pj = step == EditOperation.DELETION ? j : j - 1;
                subs[i][j] = subs[pi][pj];
                dels[i][j] = dels[pi][pj];
                ins[i][j] = ins[pi][pj];
                switch (step) {
                    case SUBSTITUTION -> subs[i][j]++;
                    case DELETION -> dels[i][j]++;
                    case INSERTION -> ins[i][j]++;
                    case MATCH -> { }
                }
            }
        }
        return new EditOperationCounts(subs[n][m], dels[n][m], ins[n][m], cost[n][m]);
    }

    /**
     * Aligns two token sequences along a minimum-cost edit path.
     *
     * <p>Backtracks from {@code (|reference|, |hypothesis|)} to {@code (0, 0)} using the tie-break
     * rule, then reverses the collected steps into reading order.
     *
     * @param reference  reference sequence (may be null)
     * @param hypothesis hypothesis sequence (may be null)
     * @param <T>        token type
     * @return alignment covering every index of both sequences exactly once
     */
    public <T> WordAlignment align(List<T> reference, List<T> hypothesis) {
        List<T> ref = reference == null ? List.of() : reference;
        List<T> hyp = hypothesis == null ? List.of() : hypothesis;
        int[][] cost = costTable(ref, hyp);

        List<AlignedPair> pairs = new ArrayList<>(ref.size() + hyp.size());
        int i = ref.size();
        int j = hyp.size();
        while (i > 0 || j > 0) {
            EditOperation step = chooseStep(cost, ref, hyp, i, j);
            switch (step) {
                case MATCH -> pairs.add(AlignedPair.match(--i, --j));
                case SUBSTITUTION -> pairs.add(AlignedPair.substitution(--i, --j));
                case DELETION -> pairs.add(AlignedPair.deletion(--i));
                case INSERTION -> pairs.add(AlignedPair.insertion(--j));
            }
        }
        Collections.reverse(pairs);
        return new WordAlignment(pairs);
    }

    /**
     * Full (n+1) x (m+1) cost table; {@code cost[i][j]} is the distance between the first
     * {@code i} reference tokens and the first {@code j} hypothesis tokens.
     */
    private static <T> int[][] costTable(List<T> ref, List<T> hyp) {
        int n = ref.size();
        int m = hyp.size();
        int[][] cost = new int[n + 1][m + 1];
        for (int i = 0; i <= n; i++) {
            cost[i][0] = i;
        }
        for (int j = 0; j <= m; j++) {
            cost[0][j] = j;
        }
        for (int i = 1; i <= n; i++) {
            T token = ref.get(i - 1);
            for (int j = 1; j <= m; j++) {
                int diagonal = cost[i - 1][j - 1] + (Objects.equals(token, hyp.get(j - 1)) ? 0 : 1);
                int deletion = cost[i - 1][j] + 1;
                int insertion = cost[i][j - 1] + 1;
                cost[i][j] = Math.min(diagonal, Math.min(deletion, insertion));
            }
        }
        return cost;
    }

    /**
     * Picks the step that produced {@code cost[i][j]}, preferring match, then substitution,
     * then deletion, then insertion. Requires {@code i > 0 || j > 0}.
     */
    private static <T> EditOperation chooseStep(int[][] cost, List<T> ref, List<T> hyp, int i, int j) {
        if (i > 0 && j > 0) {
            boolean equal = Objects.equals(ref.get(i - 1), hyp.get(j - 1));
            if (cost[i][j] == cost[i - 1][j - 1] + (equal ? 0 : 1)) {
                return equal ? EditOperation.MATCH : EditOperation.SUBSTITUTION;
            }
        }
        if (i > 0 && cost[i][j] == cost[i - 1][j] + 1) {
            return EditOperation.DELETION;
        }
        return EditOperation.INSERTION;
    }
}
