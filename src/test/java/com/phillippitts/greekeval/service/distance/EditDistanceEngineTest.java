package com.phillippitts.greekeval.service.distance;

import com.phillippitts.greekeval.domain.AlignedPair;
import com.phillippitts.greekeval.domain.EditOperation;
import com.phillippitts.greekeval.domain.EditOperationCounts;
import com.phillippitts.greekeval.domain.WordAlignment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class EditDistanceEngineTest {

    private final EditDistanceEngine engine = new EditDistanceEngine();

    private static List<String> chars(String s) {
        return s.isEmpty() ? List.of() : List.of(s.split(""));
    }

    @Test
    void emptyVersusEmptyIsZero() {
        assertThat(engine.distance(List.of(), List.of())).isZero();
        assertThat(engine.distanceDetailed(List.of(), List.of())).isEqualTo(EditOperationCounts.zero());
        assertThat(engine.align(List.of(), List.of()).pairs()).isEmpty();
    }

    @Test
    void emptyVersusNonEmptyIsLengthOfOther() {
        assertThat(engine.distance(List.of(), chars("abc"))).isEqualTo(3);
        assertThat(engine.distance(chars("abcd"), List.of())).isEqualTo(4);
    }

    @Test
    void nullSequencesTreatedAsEmpty() {
        assertThat(engine.distance(null, chars("ab"))).isEqualTo(2);
        assertThat(engine.distanceDetailed(chars("ab"), null))
                .isEqualTo(EditOperationCounts.of(0, 2, 0));
        assertThat(engine.align(null, null).pairs()).isEmpty();
    }

    @Test
    void computesClassicDistance() {
        assertThat(engine.distance(chars("kitten"), chars("sitting"))).isEqualTo(3);
        assertThat(engine.distance(chars("flaw"), chars("lawn"))).isEqualTo(2);
    }

    @Test
    void worksOnWordTokens() {
        List<String> ref = List.of("το", "παιδί", "έπαιζε", "στην", "αυλή");
        List<String> hyp = List.of("το", "παιδι", "επαιζε", "στην", "αυλη");

        assertThat(engine.distance(ref, hyp)).isEqualTo(3);
    }

    @Test
    void distanceIsSymmetric() {
        assertThat(engine.distance(chars("kitten"), chars("sitting")))
                .isEqualTo(engine.distance(chars("sitting"), chars("kitten")));
        assertThat(engine.distance(chars("a"), chars("abcdef")))
                .isEqualTo(engine.distance(chars("abcdef"), chars("a")));
    }

    @Test
    void detailedCountsSubstitution() {
        EditOperationCounts counts = engine.distanceDetailed(chars("abc"), chars("axc"));

        assertThat(counts).isEqualTo(new EditOperationCounts(1, 0, 0, 1));
    }

    @Test
    void detailedCountsDeletion() {
        EditOperationCounts counts = engine.distanceDetailed(chars("abc"), chars("ac"));

        assertThat(counts).isEqualTo(new EditOperationCounts(0, 1, 0, 1));
    }

    @Test
    void detailedCountsInsertion() {
        EditOperationCounts counts = engine.distanceDetailed(chars("ac"), chars("abc"));

        assertThat(counts).isEqualTo(new EditOperationCounts(0, 0, 1, 1));
    }

    @Test
    void tieBreakPrefersSubstitutionOverDeleteInsert() {
        // a -> b costs 1 as a substitution or 2 as delete+insert; swapped pair resolves to two substitutions
        assertThat(engine.distanceDetailed(chars("a"), chars("b"))).isEqualTo(EditOperationCounts.of(1, 0, 0));
        assertThat(engine.distanceDetailed(chars("ab"), chars("ba"))).isEqualTo(EditOperationCounts.of(2, 0, 0));
    }

    @Test
    void detailedKittenSitting() {
        assertThat(engine.distanceDetailed(chars("kitten"), chars("sitting")))
                .isEqualTo(EditOperationCounts.of(2, 0, 1));
    }

    @Test
    void alignmentMarksDeletionWithNullHypothesisIndex() {
        WordAlignment alignment = engine.align(chars("abc"), chars("ac"));

        assertThat(alignment.pairs()).containsExactly(
                AlignedPair.match(0, 0),
                AlignedPair.deletion(1),
                AlignedPair.match(2, 1));
    }

    @Test
    void alignmentMarksInsertionWithNullReferenceIndex() {
        WordAlignment alignment = engine.align(chars("ac"), chars("abc"));

        assertThat(alignment.pairs()).containsExactly(
                AlignedPair.match(0, 0),
                AlignedPair.insertion(1),
                AlignedPair.match(1, 2));
    }

    @Test
    void alignmentIsInReadingOrder() {
        WordAlignment alignment = engine.align(chars("kitten"), chars("sitting"));

        assertThat(alignment.pairs()).first().isEqualTo(AlignedPair.substitution(0, 0));
        assertThat(alignment.pairs()).last().isEqualTo(AlignedPair.insertion(6));
        assertThat(alignment.cost()).isEqualTo(3);
    }

    @Test
    void operationCountsAgreeWithDistanceAndAlignment() {
        Random random = new Random(42);
        for (int run = 0; run < 200; run++) {
            List<String> a = randomTokens(random);
            List<String> b = randomTokens(random);

            int distance = engine.distance(a, b);
            EditOperationCounts counts = engine.distanceDetailed(a, b);
            WordAlignment alignment = engine.align(a, b);

            assertThat(counts.distance()).isEqualTo(distance);
            assertThat(counts.substitutions() + counts.deletions() + counts.insertions()).isEqualTo(distance);
            assertThat(alignment.cost()).isEqualTo(distance);
            assertThat(countOf(alignment, EditOperation.SUBSTITUTION)).isEqualTo(counts.substitutions());
            assertThat(countOf(alignment, EditOperation.DELETION)).isEqualTo(counts.deletions());
            assertThat(countOf(alignment, EditOperation.INSERTION)).isEqualTo(counts.insertions());
            assertThat(engine.distance(b, a)).isEqualTo(distance);
        }
    }

    @Test
    void alignmentCoversEveryIndexExactlyOnce() {
        Random random = new Random(7);
        for (int run = 0; run < 200; run++) {
            List<String> a = randomTokens(random);
            List<String> b = randomTokens(random);

            WordAlignment alignment = engine.align(a, b);

            List<Integer> refIndices = new ArrayList<>();
            List<Integer> hypIndices = new ArrayList<>();
            for (AlignedPair pair : alignment.pairs()) {
                if (pair.referenceIndex() != null) {
                    refIndices.add(pair.referenceIndex());
                }
                if (pair.hypothesisIndex() != null) {
                    hypIndices.add(pair.hypothesisIndex());
                }
            }
            assertThat(refIndices).isEqualTo(range(a.size()));
            assertThat(hypIndices).isEqualTo(range(b.size()));
        }
    }

    @Test
    void matchedPairsHoldEqualTokens() {
        List<String> a = chars("intention");
        List<String> b = chars("execution");

        for (AlignedPair pair : engine.align(a, b).pairs()) {
            if (pair.operation() == EditOperation.MATCH) {
                assertThat(a.get(pair.referenceIndex())).isEqualTo(b.get(pair.hypothesisIndex()));
            }
            if (pair.operation() == EditOperation.SUBSTITUTION) {
                assertThat(a.get(pair.referenceIndex())).isNotEqualTo(b.get(pair.hypothesisIndex()));
            }
        }
    }

    @Test
    void resultsAreDeterministicAcrossRuns() {
        List<String> a = chars("abcabcabc");
        List<String> b = chars("cbacbacba");
        Set<WordAlignment> alignments = new HashSet<>();
        for (int i = 0; i < 10; i++) {
            alignments.add(engine.align(a, b));
        }
        assertThat(alignments).hasSize(1);
    }

    private static List<String> randomTokens(Random random) {
        int length = random.nextInt(9);
        List<String> tokens = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            tokens.add(String.valueOf((char) ('a' + random.nextInt(4))));
        }
        return tokens;
    }

    private static int countOf(WordAlignment alignment, EditOperation operation) {
        return (int) alignment.pairs().stream().filter(p -> p.operation() == operation).count();
    }

    private static List<Integer> range(int n) {
        List<Integer> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(i);
        }
        return out;
    }
}
