package com.conveyal.wtt;

import com.conveyal.wtt.error.ErrorStorage;
import com.conveyal.wtt.error.NewWTTErrorType;
import com.conveyal.wtt.loader.ServiceExtractor;
import com.conveyal.wtt.model.Service;
import gnu.trove.list.TIntList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.conveyal.wtt.TestGrids.indexed;
import static com.conveyal.wtt.TestGrids.service;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LinkageGraphTest {

    private ErrorStorage errorStorage;

    @BeforeEach
    public void setUp() {
        errorStorage = new ErrorStorage();
    }

    @Test
    public void canFindChainsAcrossDirections() {
        ServiceExtractor extractor = new ServiceExtractor(TestGrids.directory(), errorStorage);
        List<Service> services = new ArrayList<>(extractor.extractServices(TestGrids.upGrid()));
        services.addAll(extractor.extractServices(TestGrids.downGrid()));
        for (int i = 0; i < services.size(); i++) services.get(i).index = i;

        LinkageGraph graph = new LinkageGraph(services, errorStorage);
        List<String> chains = graph.getChains().stream()
            .map(chain -> ids(graph.servicesOf(chain)))
            .collect(Collectors.toList());
        assertThat(chains, containsInAnyOrder("93001 93002", "93005 93006", "93011 93012", "93009 93010"));
        assertThat(errorStorage.getErrors(NewWTTErrorType.SUCCESSOR_UNKNOWN), empty());

        assertTrue(graph.isSuccessorOfAnother("93010"));
        assertFalse(graph.isSuccessorOfAnother("93009"));
        assertTrue(graph.hasPredecessor(graph.indexOf("93010")));
        // A service on its own is not the start of a chain.
        assertThat(graph.chainFrom(graph.indexOf("93003")), nullValue());
    }

    @Test
    public void firstDeclarationOfIdentifierWins() {
        List<Service> services = indexed(service("93001", null), service("93001", null), service("93002", "93001"));
        LinkageGraph graph = new LinkageGraph(services, errorStorage);
        assertThat(graph.indexOf("93001"), equalTo(0));
        assertThat(graph.getSuccessor(2), equalTo(0));
        assertThat(errorStorage.getErrors(NewWTTErrorType.DUPLICATE_SERVICE_ID), hasSize(1));
    }

    @Test
    public void recordsUnknownSuccessors() {
        LinkageGraph graph = new LinkageGraph(indexed(service("93001", "93999")), errorStorage);
        assertThat(graph.getSuccessor(0), equalTo(LinkageGraph.NO_SUCCESSOR));
        assertThat(graph.getChains(), empty());
        // The reference is still remembered, so 93999 counts as reversed into.
        assertTrue(graph.isSuccessorOfAnother("93999"));
        assertThat(errorStorage.getErrors(NewWTTErrorType.SUCCESSOR_UNKNOWN), hasSize(1));
    }

    @Test
    public void truncatesCycles() {
        List<Service> services = indexed(
            service("93001", "93002"),
            service("93002", "93003"),
            service("93003", "93002")
        );
        LinkageGraph graph = new LinkageGraph(services, errorStorage);
        TIntList chain = graph.chainFrom(0);
        assertThat(ids(graph.servicesOf(chain)), equalTo("93001 93002 93003"));
        assertThat(errorStorage.getErrors(NewWTTErrorType.CHAIN_CYCLE), hasSize(1));
    }

    @Test
    public void visitsMergingServiceOnce() {
        List<Service> services = indexed(
            service("93001", "93005"),
            service("93003", "93005"),
            service("93005", null)
        );
        LinkageGraph graph = new LinkageGraph(services, errorStorage);
        assertThat(ids(graph.servicesOf(graph.chainFrom(0))), equalTo("93001 93005"));
        assertThat(graph.chainFrom(1).size(), equalTo(1));
        assertThat(graph.getChains(), hasSize(2));
    }

    @Test
    public void closedLoopHasNoChainStart() {
        List<Service> services = indexed(service("93001", "93002"), service("93002", "93001"));
        LinkageGraph graph = new LinkageGraph(services, errorStorage);
        assertThat(graph.getChains(), empty());
        assertTrue(graph.hasPredecessor(0));
    }

    private static String ids(List<Service> services) {
        return services.stream().map(Service::getId).collect(Collectors.joining(" "));
    }

}
