package com.platform.configdrift.drift;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.classify.ChangeStatus;
import com.platform.configdrift.classify.ComparisonSummary;
import com.platform.configdrift.classify.DiffClassifier;
import com.platform.configdrift.classify.EntityChange;
import com.platform.configdrift.classify.FieldChange;
import com.platform.configdrift.classify.FlatClassifier;
import com.platform.configdrift.classify.SummaryCounts;
import com.platform.configdrift.diff.FlatDiffer;
import com.platform.configdrift.diff.StructuralDiffer;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Stream;

import static com.platform.configdrift.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;

class ComparisonEngineTest {

    private static final StructuralComparisonEngine STRUCTURAL =
            new StructuralComparisonEngine(new StructuralDiffer(), new DiffClassifier());
    private static final FlatComparisonEngine FLAT =
            new FlatComparisonEngine(new FlatDiffer(), new FlatClassifier());

    static Stream<ComparisonEngine> engines() {
        return Stream.of(STRUCTURAL, FLAT);
    }

    @ParameterizedTest
    @MethodSource("engines")
    void comparingSnapshotWithItselfFindsNothing(ComparisonEngine engine) {
        List<JsonNode> snapshots = List.of(
                json("{}"),
                json("[]"),
                json("{'name': 'HQ', 'tags': ['a', 'b'], 'nested': {'x': [1, {'y': null}]}}"),
                json("[{'name': 'corp', 'vlan': 10, 'radius': [{'host': '10.0.0.1'}]}, {'name': 'guest'}]"));

        for (JsonNode snapshot : snapshots) {
            ComparisonSummary summary = engine.compare(snapshot, snapshot.deepCopy(), "name", "self");
            assertThat(summary.relevantChanges()).isEmpty();
            assertThat(summary.otherChanges()).isEmpty();
            assertThat(summary.hasDiffs()).isFalse();
        }
    }

    @ParameterizedTest
    @MethodSource("engines")
    void groupedComparisonIgnoresElementOrder(ComparisonEngine engine) {
        JsonNode baseline = json("[{'portId': '1', 'vlan': 10}, {'portId': '2', 'vlan': 20}, {'portId': '3'}]");
        JsonNode current = json("[{'portId': '3'}, {'portId': '1', 'vlan': 10}, {'portId': '2', 'vlan': 20}]");

        assertThat(engine.compare(baseline, current, "portId", "switch").hasDiffs()).isFalse();
    }

    @ParameterizedTest
    @MethodSource("engines")
    void groupedChangesDoNotDependOnElementOrder(ComparisonEngine engine) {
        JsonNode baseline = json("[{'portId': '1', 'vlan': 10}, {'portId': '2', 'vlan': 20}, {'portId': '3', 'vlan': 30}]");
        JsonNode current = json("[{'portId': '1', 'vlan': 10}, {'portId': '2', 'vlan': 21}, {'portId': '4', 'vlan': 40}]");
        JsonNode shuffledBaseline = json("[{'portId': '3', 'vlan': 30}, {'portId': '1', 'vlan': 10}, {'portId': '2', 'vlan': 20}]");
        JsonNode shuffledCurrent = json("[{'portId': '4', 'vlan': 40}, {'portId': '2', 'vlan': 21}, {'portId': '1', 'vlan': 10}]");

        ComparisonSummary ordered = engine.compare(baseline, current, "portId", "ordered");
        ComparisonSummary shuffled = engine.compare(shuffledBaseline, shuffledCurrent, "portId", "shuffled");

        assertThat(ordered.summaryCounts()).isEqualTo(new SummaryCounts(1, 1, 1, 0));
        assertThat(shuffled.summaryCounts()).isEqualTo(ordered.summaryCounts());
        assertThat(shuffled.relevantChanges()).containsExactlyInAnyOrderElementsOf(ordered.relevantChanges());
        assertThat(ordered.relevantChanges())
                .filteredOn(change -> "2".equals(change.itemId()))
                .singleElement()
                .satisfies(change -> assertThat(change.changes())
                        .containsExactly(new FieldChange("vlan", json("20"), json("21"))));
    }

    @ParameterizedTest
    @MethodSource("engines")
    void additionsAndRemovalsAreComplementary(ComparisonEngine engine) {
        JsonNode a = json("[{'name': 'corp', 'vlan': 10}, {'name': 'iot', 'vlan': 30}]");
        JsonNode b = json("[{'name': 'corp', 'vlan': 10}, {'name': 'guest', 'vlan': 20}]");

        ComparisonSummary forward = engine.compare(a, b, "name", "forward");
        ComparisonSummary backward = engine.compare(b, a, "name", "backward");

        assertThat(idsWithStatus(forward, ChangeStatus.ADDED)).isEqualTo(idsWithStatus(backward, ChangeStatus.REMOVED));
        assertThat(idsWithStatus(forward, ChangeStatus.REMOVED)).isEqualTo(idsWithStatus(backward, ChangeStatus.ADDED));
        assertThat(idsWithStatus(forward, ChangeStatus.ADDED)).containsExactly("guest");
    }

    @Test
    void replacedTopLevelKeysCarryTheirFullValues() {
        JsonNode a = json("{'corp': {'vlan': 10}, 'iot': {'vlan': 30, 'psk': 'x'}}");
        JsonNode b = json("{'corp': {'vlan': 10}, 'guest': {'vlan': 20}}");

        ComparisonSummary forward = STRUCTURAL.compare(a, b, null, "forward");
        ComparisonSummary backward = STRUCTURAL.compare(b, a, null, "backward");

        assertThat(forward.relevantChanges()).containsExactly(
                new EntityChange("iot", ChangeStatus.REMOVED,
                        List.of(new FieldChange(null, json("{'vlan': 30, 'psk': 'x'}"), FieldChange.NOT_AVAILABLE))),
                new EntityChange("guest", ChangeStatus.ADDED,
                        List.of(new FieldChange(null, FieldChange.NOT_AVAILABLE, json("{'vlan': 20}")))));
        assertThat(backward.relevantChanges()).containsExactlyInAnyOrder(
                new EntityChange("guest", ChangeStatus.REMOVED,
                        List.of(new FieldChange(null, json("{'vlan': 20}"), FieldChange.NOT_AVAILABLE))),
                new EntityChange("iot", ChangeStatus.ADDED,
                        List.of(new FieldChange(null, FieldChange.NOT_AVAILABLE, json("{'vlan': 30, 'psk': 'x'}")))));
    }

    @ParameterizedTest
    @MethodSource("engines")
    void invalidSnapshotYieldsEmptySummary(ComparisonEngine engine) {
        ComparisonSummary summary = engine.compare(json("'text'"), json("{}"), null, "broken");

        assertThat(summary.hasDiffs()).isFalse();
        assertThat(summary.relevantChanges()).isEmpty();
    }

    @Test
    void flatEngineReportsWholeAddedItem() {
        ComparisonSummary summary = FLAT.compare(
                json("[{'name': 'corp', 'vlan': 10}]"),
                json("[{'name': 'corp', 'vlan': 11}, {'name': 'guest', 'vlan': 20}]"),
                "name", "network");

        assertThat(summary.relevantChanges()).extracting(EntityChange::itemId).containsExactly("corp", "guest");
        EntityChange corp = summary.relevantChanges().get(0);
        assertThat(corp.status()).isEqualTo(ChangeStatus.CHANGED);
        assertThat(corp.changes()).containsExactly(new FieldChange("vlan", json("10"), json("11")));
        EntityChange guest = summary.relevantChanges().get(1);
        assertThat(guest.status()).isEqualTo(ChangeStatus.ADDED);
        assertThat(guest.changes()).containsExactly(
                new FieldChange(null, FieldChange.NOT_AVAILABLE, json("{'name': 'guest', 'vlan': 20}")));
        assertThat(summary.summaryCounts().added()).isEqualTo(1);
        assertThat(summary.summaryCounts().changed()).isEqualTo(1);
        assertThat(summary.summaryCounts().other()).isZero();
    }

    @Test
    void flatEngineWithoutGroupingKeyUsesGlobalConfiguration() {
        ComparisonSummary summary = FLAT.compare(json("{'a': {'b': 1}}"), json("{'a': {'b': 2}}"), null, "org");

        assertThat(summary.relevantChanges()).singleElement()
                .satisfies(change -> {
                    assertThat(change.itemId()).isEqualTo(FlatClassifier.GLOBAL_ITEM);
                    assertThat(change.changes()).containsExactly(new FieldChange("a.b", json("1"), json("2")));
                });
    }

    @Test
    void registryResolvesMethodNamesAndAliases() {
        ComparisonEngineRegistry registry = new ComparisonEngineRegistry(List.of(STRUCTURAL, FLAT));

        assertThat(registry.getEngine("deepdiff")).isSameAs(STRUCTURAL);
        assertThat(registry.getEngine("Structural")).isSameAs(STRUCTURAL);
        assertThat(registry.getEngine("flat")).isSameAs(FLAT);
    }

    private static List<Object> idsWithStatus(ComparisonSummary summary, ChangeStatus status) {
        return summary.relevantChanges().stream()
                .filter(change -> change.status() == status)
                .map(EntityChange::itemId)
                .toList();
    }
}
