package com.strata.lookup.merge;

import com.strata.lookup.ConfigurationException;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupResult;
import com.strata.lookup.MergeTypeException;
import com.strata.lookup.Scope;
import com.strata.lookup.UnrecognizedMergeException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MergeStrategyTest {

    private static final Object MISSING = new Object();

    private final Invocation invocation = new Invocation(Scope.empty());

    private static LookupResult attempt(Object source) {
        return source == MISSING ? LookupResult.notFound() : LookupResult.found(source);
    }

    @Test
    void strategy_nullIsFirstFound() {
        assertInstanceOf(FirstFoundStrategy.class, MergeStrategy.strategy(null));
    }

    @Test
    void strategy_fromMapWithOptions() {
        Map<String, Object> merge = new LinkedHashMap<>();
        merge.put("strategy", "deep");
        merge.put("knockout_prefix", "--");
        MergeStrategy s = MergeStrategy.strategy(merge);
        assertInstanceOf(DeepMergeStrategy.class, s);
        assertEquals("--", s.getOptions().get("knockout_prefix"));
        assertEquals(merge, s.getConfiguration());
    }

    @Test
    void strategy_mapWithoutOptionsReusesDefault() {
        assertSame(MergeStrategy.strategy("hash"), MergeStrategy.strategy(Map.of("strategy", "hash")));
    }

    @Test
    void strategy_unrecognizedIsFatal() {
        assertThrows(UnrecognizedMergeException.class, () -> MergeStrategy.strategy("bogus"));
        assertThrows(UnrecognizedMergeException.class, () -> MergeStrategy.strategy(Map.of("strategy", "bogus")));
        assertThrows(UnrecognizedMergeException.class, () -> MergeStrategy.strategy(Map.of("knockout_prefix", "--")));
        assertThrows(UnrecognizedMergeException.class, () -> MergeStrategy.strategy(42));
    }

    @Test
    void strategy_rejectsUnknownOptions() {
        assertThrows(ConfigurationException.class,
                () -> MergeStrategy.strategy(Map.of("strategy", "deep", "colour", "blue")));
        assertThrows(ConfigurationException.class,
                () -> MergeStrategy.strategy(Map.of("strategy", "unique", "sort_merge_arrays", true)));
    }

    @Test
    void first_stopsAtFirstFoundSource() {
        List<Object> consulted = new ArrayList<>();
        Function<Object, LookupResult> recording = source -> {
            consulted.add(source);
            return attempt(source);
        };
        LookupResult result = MergeStrategy.strategy("first").lookup(List.of(MISSING, 5, 6), invocation, recording);
        assertEquals(LookupResult.found(5), result);
        assertEquals(List.of(MISSING, 5), consulted);
    }

    @Test
    void first_allMissingIsNotFound() {
        LookupResult result = MergeStrategy.strategy("first").lookup(List.of(MISSING, MISSING), invocation,
                MergeStrategyTest::attempt);
        assertTrue(result.isNotFound());
    }

    @Test
    void unique_concatenatesWithoutDuplicates() {
        LookupResult result = MergeStrategy.strategy("unique").lookup(
                List.of(List.of(1, 2), List.of(2, 3)), invocation, MergeStrategyTest::attempt);
        assertEquals(LookupResult.found(List.of(1, 2, 3)), result);
    }

    @Test
    void unique_singleSourceIsDeduplicated() {
        LookupResult result = MergeStrategy.strategy("unique").lookup(
                List.of(List.of(1, 1, 2), MISSING), invocation, MergeStrategyTest::attempt);
        assertEquals(LookupResult.found(List.of(1, 2)), result);
    }

    @Test
    void unique_wrapsScalarsAndFlattens() {
        LookupResult result = MergeStrategy.strategy("unique").lookup(
                List.of("a", MISSING, List.of(List.of("b"), "a")), invocation, MergeStrategyTest::attempt);
        assertEquals(LookupResult.found(List.of("a", "b")), result);
    }

    @Test
    void hash_earlierSourceWins() {
        LookupResult result = MergeStrategy.strategy("hash").lookup(
                List.of(Map.of("a", 1), Map.of("a", 2, "b", 2)), invocation, MergeStrategyTest::attempt);
        assertEquals(LookupResult.found(Map.of("a", 1, "b", 2)), result);
    }

    @Test
    void hash_rejectsNonMapValues() {
        assertThrows(MergeTypeException.class, () -> MergeStrategy.strategy("hash").lookup(
                List.of(Map.of("a", 1), "text"), invocation, MergeStrategyTest::attempt));
    }

    @Test
    void deep_mergesRecursivelyWithEarlierSourceWinning() {
        Map<String, Object> high = Map.of("db", Map.of("host", "primary", "opts", List.of("ssl")));
        Map<String, Object> low = Map.of("db", Map.of("host", "fallback", "port", 5432, "opts", List.of("pool")));
        Object merged = MergeStrategy.strategy("deep").merge(high, low);
        assertEquals(Map.of("db", Map.of("host", "primary", "port", 5432, "opts", List.of("pool", "ssl"))), merged);
    }

    @Test
    void reverseDeep_laterSourceWins() {
        Map<String, Object> first = Map.of("db", Map.of("host", "primary"));
        Map<String, Object> second = Map.of("db", Map.of("host", "fallback", "port", 5432));
        LookupResult result = MergeStrategy.strategy("reverse_deep").lookup(List.of(first, second), invocation,
                MergeStrategyTest::attempt);
        assertEquals(LookupResult.found(Map.of("db", Map.of("host", "fallback", "port", 5432))), result);
    }

    @Test
    void deep_knockoutPrefixRemovesKeysAndElements() {
        MergeStrategy deep = MergeStrategy.strategy(Map.of("strategy", "deep", "knockout_prefix", "--"));
        Map<String, Object> high = Map.of("users", List.of("--bob", "carol"), "legacy", "--");
        Map<String, Object> low = Map.of("users", List.of("alice", "bob"), "legacy", true, "keep", 1);
        assertEquals(Map.of("users", List.of("alice", "carol"), "keep", 1), deep.merge(high, low));

        assertEquals(Map.of("b", "y"), deep.merge(Map.of("a", "--gone"), Map.of("a", "x", "b", "y")));
        assertEquals(Map.of("n", Map.of("b", "y"), "other", 1),
                deep.merge(Map.of("n", Map.of("a", "--gone", "b", "y")), Map.of("other", 1)));
    }

    @Test
    void deep_sortAndMergeHashArrays() {
        MergeStrategy deep = MergeStrategy.strategy(Map.of("strategy", "deep",
                "sort_merge_arrays", true, "merge_hash_arrays", true));
        assertEquals(List.of(1, 2, 3), deep.merge(List.of(3, 1), List.of(2)));
        assertEquals(List.of(Map.of("a", 1, "b", 2)), deep.merge(List.of(Map.of("a", 1)), List.of(Map.of("b", 2))));
    }

    @Test
    void deep_doesNotMutateInputs() {
        Map<String, Object> low = new LinkedHashMap<>();
        low.put("k", new ArrayList<>(List.of(1)));
        MergeStrategy.strategy("deep").merge(Map.of("k", List.of(2)), low);
        assertEquals(List.of(1), low.get("k"));
    }
}
