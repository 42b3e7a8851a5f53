package com.urbanairship.dimstitch;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Shuffles the batches after the base batch and checks the stitched rows stay the same, only their
 * order may change.
 */
public class JoinOrderTest {
    private static final List<String> STITCH = ImmutableList.of("ga:dimension1");
    private static final int ROUNDS = 200;

    @Test
    public void testInnerJoinOrderDoesNotChangeRows() {
        checkJoinOrder(JoinPolicy.INNER, new Random(1234L));
    }

    @Test
    public void testLeftJoinOrderDoesNotChangeRows() {
        checkJoinOrder(JoinPolicy.LEFT, new Random(5678L));
    }

    private static void checkJoinOrder(JoinPolicy joinPolicy, Random random) {
        for (int round = 0; round < ROUNDS; round++) {
            int numUsers = 1 + random.nextInt(6);
            RowSet base = rowSet(new BatchSpec("user-dimensions", GroupRole.USER,
                    ImmutableList.of("ga:dimension1", "ga:dimension2")), numUsers, random, 1);

            List<RowSet> others = new ArrayList<>();
            int numOthers = 1 + random.nextInt(4);
            for (int i = 0; i < numOthers; i++) {
                BatchSpec spec = new BatchSpec("batch-dimensions-" + i, GroupRole.ADDITIONAL,
                        ImmutableList.of("ga:dimension1", "ga:dimension" + (10 + i)));
                others.add(rowSet(spec, numUsers + 2, random, 3));
            }

            List<RowSet> inOrder = new ArrayList<>();
            inOrder.add(base);
            inOrder.addAll(others);

            List<RowSet> shuffledOthers = new ArrayList<>(others);
            Collections.shuffle(shuffledOthers, random);
            List<RowSet> shuffled = new ArrayList<>();
            shuffled.add(base);
            shuffled.addAll(shuffledOthers);

            StitchResult expected = new Stitcher(joinPolicy).stitch(inOrder, STITCH);
            StitchResult actual = new Stitcher(joinPolicy).stitch(shuffled, STITCH);

            Multiset<CombinedRow> expectedRows = HashMultiset.create(expected.getRows());
            Multiset<CombinedRow> actualRows = HashMultiset.create(actual.getRows());
            Assert.assertEquals("Round " + round + " with " + joinPolicy, expectedRows, actualRows);
            Assert.assertEquals(expected.getRows().size(), actual.getRows().size());
        }
    }

    /**
     * Up to maxRowsPerKey rows for some of the user keys u0..u(numKeys-1). With maxRowsPerKey 1 each key
     * appears at most once, like a base batch.
     */
    private static RowSet rowSet(BatchSpec spec, int numKeys, Random random, int maxRowsPerKey) {
        String valueDimension = spec.getDimensionIds().get(1);
        List<Row> rows = new ArrayList<>();
        for (int key = 0; key < numKeys; key++) {
            int rowsForKey = maxRowsPerKey == 1 ? 1 : random.nextInt(maxRowsPerKey + 1);
            for (int i = 0; i < rowsForKey; i++) {
                rows.add(new Row(ImmutableMap.of(
                        "ga:dimension1", "u" + key,
                        valueDimension, valueDimension + "-" + random.nextInt(3))));
            }
        }
        Collections.shuffle(rows, random);
        return new RowSet(spec, rows);
    }
}
