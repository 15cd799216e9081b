package com.platform.configdrift.entity;

import com.platform.configdrift.operation.OperationDescriptor;
import com.platform.configdrift.operation.OperationScope;
import com.platform.configdrift.operation.SnapshotFetcher;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class EntityFiltersTest {

    private static final EntityRecord SWITCH = EntityRecord.device(
            "Q2AA-1111", "core-sw", List.of("core", "floor1"), "switch", "MS225-48", "N_1");
    private static final EntityRecord AP = EntityRecord.device(
            "Q2BB-2222", "lobby-ap", List.of("lobby"), "wireless", "MR46", "N_2");

    @Test
    void emptyCriteriaAcceptEverything() {
        EntityFilter filter = EntityFilters.forDevices(FilterCriteria.none(), null, Map.of());

        assertThat(filter.accept(SWITCH)).isTrue();
        assertThat(filter.accept(AP)).isTrue();
    }

    @Test
    void organizationsAreFilteredById() {
        EntityFilter filter = EntityFilters.forOrganizations(List.of("1", "3"));

        assertThat(filter.accept(EntityRecord.organization("1", "Acme"))).isTrue();
        assertThat(filter.accept(EntityRecord.organization("2", "Other"))).isFalse();
    }

    @Test
    void networksNeedOneTagAndTheProductType() {
        EntityFilter filter = EntityFilters.forNetworks(List.of("retail", "lab"), "wireless");

        assertThat(filter.accept(EntityRecord.network("N_1", "Store", List.of("retail"), List.of("wireless", "switch"))))
                .isTrue();
        assertThat(filter.accept(EntityRecord.network("N_2", "Office", List.of("hq"), List.of("wireless"))))
                .isFalse();
        assertThat(filter.accept(EntityRecord.network("N_3", "Lab", List.of("lab"), List.of("appliance"))))
                .isFalse();
    }

    @Test
    void deviceAllowListsMustAllMatch() {
        FilterCriteria criteria = new FilterCriteria(null, null, List.of("core"), List.of("MS225-48", "MS120-8"), null);
        EntityFilter filter = EntityFilters.forDevices(criteria, null, Map.of());

        assertThat(filter.accept(SWITCH)).isTrue();
        assertThat(filter.accept(EntityRecord.device("Q2CC", "edge", List.of("core"), "switch", "MS390", "N_1")))
                .isFalse();
        assertThat(filter.accept(AP)).isFalse();
    }

    @Test
    void operationProductTypeAppliesWithoutExplicitProductTypes() {
        EntityFilter implicit = EntityFilters.forDevices(FilterCriteria.none(), "switch", Map.of());
        EntityFilter explicit = EntityFilters.forDevices(
                new FilterCriteria(null, null, null, null, List.of("wireless")), "switch", Map.of());

        assertThat(implicit.accept(SWITCH)).isTrue();
        assertThat(implicit.accept(AP)).isFalse();
        assertThat(explicit.accept(AP)).isTrue();
        assertThat(explicit.accept(SWITCH)).isFalse();
    }

    @Test
    void devicesAreFilteredByTheirNetworkTags() {
        FilterCriteria criteria = new FilterCriteria(null, List.of("campus"), null, null, null);
        EntityFilter filter = EntityFilters.forDevices(criteria, null,
                Map.of("N_1", List.of("campus", "east"), "N_2", List.of("branch")));

        assertThat(filter.accept(SWITCH)).isTrue();
        assertThat(filter.accept(AP)).isFalse();
        assertThat(filter.accept(EntityRecord.device("Q2DD", "orphan", List.of(), "switch", "MS120", "N_9")))
                .isFalse();
    }

    @Test
    void blankCriteriaValuesAreIgnored() {
        FilterCriteria criteria = new FilterCriteria(null, Arrays.asList(" ", null), List.of(" core "), null, null);

        assertThat(criteria.hasNetworkTags()).isFalse();
        assertThat(criteria.deviceTags()).containsExactly("core");
    }

    @Test
    void scopeSelectsTheMatchingFilter() {
        OperationDescriptor descriptor = OperationDescriptor.builder()
                .name("switchport_on_switch")
                .scope(OperationScope.DEVICE_LEVEL)
                .productType("switch")
                .fetcher(mock(SnapshotFetcher.class))
                .build();

        EntityFilter filter = EntityFilters.forScope(descriptor, FilterCriteria.none(), Map.of());

        assertThat(filter.accept(SWITCH)).isTrue();
        assertThat(filter.accept(AP)).isFalse();
    }

    @Test
    void filtersCombine() {
        EntityFilter switches = entity -> entity.productTypes().contains("switch");
        EntityFilter core = entity -> entity.tags().contains("core");

        assertThat(switches.and(core).accept(SWITCH)).isTrue();
        assertThat(switches.and(core).accept(AP)).isFalse();
    }
}
