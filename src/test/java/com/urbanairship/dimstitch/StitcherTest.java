package com.urbanairship.dimstitch;

import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class StitcherTest {
    private static final List<String> STITCH = ImmutableList.of("ga:dimension1");

    private static final BatchSpec USER = new BatchSpec("user-dimensions", GroupRole.USER,
            ImmutableList.of("ga:dimension1", "ga:dimension2"));
    private static final BatchSpec RESULTS = new BatchSpec("results-dimensions", GroupRole.RESULTS,
            ImmutableList.of("ga:dimension1", "ga:eventCategory"));
    private static final BatchSpec ACTIONS = new BatchSpec("batch-dimensions-1", GroupRole.ADDITIONAL,
            ImmutableList.of("ga:eventAction", "ga:dimension1"));

    @Test
    public void testOneBaseRowManyResults() {
        RowSet users = new RowSet(USER, ImmutableList.of(Row.of("dimension1", "u1", "dimension2", "USA")));
        RowSet results = new RowSet(RESULTS, ImmutableList.of(
                Row.of("dimension1", "u1", "eventCategory", "click"),
                Row.of("dimension1", "u1", "eventCategory", "view")));

        StitchResult result = new Stitcher().stitch(ImmutableList.of(users, results), STITCH);

        Assert.assertEquals(ImmutableList.of("ga:dimension1", "ga:dimension2", "ga:eventCategory"),
                result.getColumns());
        Assert.assertEquals(2, result.getRows().size());
        CombinedRow click = result.getRows().get(0);
        CombinedRow view = result.getRows().get(1);
        Assert.assertEquals("u1", click.get("ga:dimension1"));
        Assert.assertEquals("USA", click.get("ga:dimension2"));
        Assert.assertEquals("click", click.get("ga:eventCategory"));
        Assert.assertEquals("u1", view.get("ga:dimension1"));
        Assert.assertEquals("USA", view.get("ga:dimension2"));
        Assert.assertEquals("view", view.get("ga:eventCategory"));
        Assert.assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    public void testInnerJoinDropsUnmatched() {
        StitchResult result = new Stitcher(JoinPolicy.INNER).stitch(unmatchedKeyInput(), STITCH);

        Assert.assertEquals(1, result.getRows().size());
        Assert.assertEquals("u1", result.getRows().get(0).get("ga:dimension1"));
        for (CombinedRow row : result.getRows()) {
            Assert.assertNotEquals("u2", row.get("ga:dimension1"));
        }
    }

    @Test
    public void testLeftJoinKeepsUnmatchedWithNulls() {
        StitchResult result = new Stitcher(JoinPolicy.LEFT).stitch(unmatchedKeyInput(), STITCH);

        Assert.assertEquals(2, result.getRows().size());
        CombinedRow u2 = result.getRows().get(1);
        Assert.assertEquals("u2", u2.get("ga:dimension1"));
        Assert.assertEquals("Canada", u2.get("ga:dimension2"));
        Assert.assertTrue(u2.has("ga:eventCategory"));
        Assert.assertNull(u2.get("ga:eventCategory"));
    }

    private static List<RowSet> unmatchedKeyInput() {
        RowSet users = new RowSet(USER, ImmutableList.of(
                Row.of("dimension1", "u1", "dimension2", "USA"),
                Row.of("dimension1", "u2", "dimension2", "Canada")));
        RowSet results = new RowSet(RESULTS, ImmutableList.of(Row.of("dimension1", "u1", "eventCategory", "click")));
        return ImmutableList.of(users, results);
    }

    @Test
    public void testSingleRowSetIsIdentity() {
        List<Row> rows = ImmutableList.of(
                Row.of("dimension1", "u1", "dimension2", "USA"),
                Row.of("dimension1", "u2", "dimension2", "Canada"),
                Row.of("dimension1", "u3", "dimension2", "Mexico"));

        StitchResult result = new Stitcher().stitch(ImmutableList.of(new RowSet(USER, rows)), STITCH);

        Assert.assertEquals(USER.getDimensionIds(), result.getColumns());
        Assert.assertEquals(rows.size(), result.getRows().size());
        for (int i = 0; i < rows.size(); i++) {
            Assert.assertEquals(rows.get(i).getValues(), result.getRows().get(i).getValues());
        }
    }

    @Test
    public void testJoinsSequentially() {
        RowSet users = new RowSet(USER, ImmutableList.of(Row.of("dimension1", "u1", "dimension2", "USA")));
        RowSet results = new RowSet(RESULTS, ImmutableList.of(
                Row.of("dimension1", "u1", "eventCategory", "click"),
                Row.of("dimension1", "u1", "eventCategory", "view")));
        RowSet actions = new RowSet(ACTIONS, ImmutableList.of(
                Row.of("dimension1", "u1", "eventAction", "play"),
                Row.of("dimension1", "u1", "eventAction", "pause")));

        StitchResult result = new Stitcher().stitch(ImmutableList.of(users, results, actions), STITCH);

        Assert.assertEquals(ImmutableList.of("ga:dimension1", "ga:dimension2", "ga:eventCategory",
                "ga:eventAction"), result.getColumns());
        // Every results row paired with every action row of the same key
        Assert.assertEquals(4, result.getRows().size());
        Assert.assertEquals("click", result.getRows().get(0).get("ga:eventCategory"));
        Assert.assertEquals("play", result.getRows().get(0).get("ga:eventAction"));
        Assert.assertEquals("click", result.getRows().get(1).get("ga:eventCategory"));
        Assert.assertEquals("pause", result.getRows().get(1).get("ga:eventAction"));
        Assert.assertEquals("view", result.getRows().get(2).get("ga:eventCategory"));
        Assert.assertEquals("play", result.getRows().get(2).get("ga:eventAction"));
        Assert.assertEquals("view", result.getRows().get(3).get("ga:eventCategory"));
        Assert.assertEquals("pause", result.getRows().get(3).get("ga:eventAction"));
        for (CombinedRow row : result.getRows()) {
            Assert.assertEquals("USA", row.get("ga:dimension2"));
        }
    }

    @Test
    public void testDuplicateBaseKeyKeepsLastRow() {
        RowSet users = new RowSet(USER, ImmutableList.of(
                Row.of("dimension1", "u1", "dimension2", "USA"),
                Row.of("dimension1", "u1", "dimension2", "Canada")));
        RowSet results = new RowSet(RESULTS, ImmutableList.of(Row.of("dimension1", "u1", "eventCategory", "click")));

        StitchResult result = new Stitcher().stitch(ImmutableList.of(users, results), STITCH);

        Assert.assertEquals(1, result.getRows().size());
        Assert.assertEquals("Canada", result.getRows().get(0).get("ga:dimension2"));
        Assert.assertEquals(1, result.getWarnings().size());
        Assert.assertTrue(result.getWarnings().get(0).contains("Duplicate stitch key"));
    }

    @Test
    public void testRowMissingStitchValueIsDropped() {
        RowSet users = new RowSet(USER, ImmutableList.of(
                Row.of("dimension1", "u1", "dimension2", "USA"),
                Row.of("dimension2", "Nowhere")));
        RowSet results = new RowSet(RESULTS, ImmutableList.of(
                Row.of("dimension1", "u1", "eventCategory", "click"),
                Row.of("eventCategory", "orphan")));

        StitchResult result = new Stitcher().stitch(ImmutableList.of(users, results), STITCH);

        Assert.assertEquals(1, result.getRows().size());
        Assert.assertEquals("click", result.getRows().get(0).get("ga:eventCategory"));
        Assert.assertEquals(2, result.getWarnings().size());
        for (String warning : result.getWarnings()) {
            Assert.assertTrue(warning, warning.contains("ga:dimension1"));
        }
    }

    @Test
    public void testEmptyStringIsAKey() {
        RowSet users = new RowSet(USER, ImmutableList.of(Row.of("dimension1", "", "dimension2", "USA")));
        RowSet results = new RowSet(RESULTS, ImmutableList.of(Row.of("dimension1", "", "eventCategory", "click")));

        StitchResult result = new Stitcher().stitch(ImmutableList.of(users, results), STITCH);

        Assert.assertEquals(1, result.getRows().size());
        Assert.assertEquals("click", result.getRows().get(0).get("ga:eventCategory"));
    }

    @Test
    public void testEmptyIncomingRowSet() {
        RowSet users = new RowSet(USER, ImmutableList.of(Row.of("dimension1", "u1", "dimension2", "USA")));
        RowSet noResults = new RowSet(RESULTS, ImmutableList.<Row>of());

        Assert.assertTrue(new Stitcher(JoinPolicy.INNER).stitch(ImmutableList.of(users, noResults), STITCH)
                .isEmpty());

        StitchResult left = new Stitcher(JoinPolicy.LEFT).stitch(ImmutableList.of(users, noResults), STITCH);
        Assert.assertEquals(1, left.getRows().size());
        Assert.assertNull(left.getRows().get(0).get("ga:eventCategory"));
    }

    @Test
    public void testEverythingEmpty() {
        StitchResult result = new Stitcher().stitch(ImmutableList.of(
                new RowSet(USER, ImmutableList.<Row>of()),
                new RowSet(RESULTS, ImmutableList.<Row>of())), STITCH);

        Assert.assertTrue(result.isEmpty());
        Assert.assertEquals(ImmutableList.of("ga:dimension1", "ga:dimension2", "ga:eventCategory"),
                result.getColumns());
    }

    @Test
    public void testCompositeStitchKey() {
        BatchSpec users = new BatchSpec("user-dimensions", GroupRole.USER,
                ImmutableList.of("ga:dimension1", "ga:dimension3", "ga:dimension2"));
        BatchSpec results = new BatchSpec("results-dimensions", GroupRole.RESULTS,
                ImmutableList.of("ga:dimension1", "ga:eventCategory", "ga:dimension3"));
        List<String> stitch = ImmutableList.of("ga:dimension1", "ga:dimension3");

        StitchResult result = new Stitcher().stitch(ImmutableList.of(
                new RowSet(users, ImmutableList.of(
                        Row.of("dimension1", "u1", "dimension3", "s1", "dimension2", "USA"),
                        Row.of("dimension1", "u1", "dimension3", "s2", "dimension2", "Canada"))),
                new RowSet(results, ImmutableList.of(
                        Row.of("dimension1", "u1", "eventCategory", "click", "dimension3", "s2")))), stitch);

        Assert.assertEquals(1, result.getRows().size());
        Assert.assertEquals("Canada", result.getRows().get(0).get("ga:dimension2"));
    }
}
