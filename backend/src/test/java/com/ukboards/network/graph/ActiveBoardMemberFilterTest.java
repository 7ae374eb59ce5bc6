package com.ukboards.network.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class ActiveBoardMemberFilterTest {
    private static final LocalDate TODAY = LocalDate.of(2020, 8, 1);

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    private BoardGraph graph() throws Exception {
        BoardGraph graph = new BoardGraph();
        graph.addNode(GraphNode.organisation("09390947", "BARBICAN", NodeKind.COMPANY, null,
            json("{\"company\": {\"company_status\": \"dissolved\"}}")));
        graph.addNode(GraphNode.member("resigned", "Resigned Officer", NodeKind.OFFICER, true,
            json("{\"resigned_on\": \"2018-10-08\"}")));
        graph.addNode(GraphNode.member("ceased", "Ceased Controller", NodeKind.CONTROLLER, true,
            json("{\"ceased_on\": \"2018-03-13\"}")));
        graph.addNode(GraphNode.member("leaving", "Leaving Officer", NodeKind.OFFICER, true,
            json("{\"resigned_on\": \"2021-01-01\"}")));
        graph.addNode(GraphNode.member("all-resigned", "Past Officer", NodeKind.OFFICER, true,
            json("{\"items\": [{\"resigned_on\": \"2008-10-16\"}, {\"resigned_on\": \"2012-01-01\"}]}")));
        graph.addNode(GraphNode.member("one-current", "Current Officer", NodeKind.OFFICER, true,
            json("{\"items\": [{\"resigned_on\": \"2008-10-16\"}, {\"appointed_on\": \"2015-01-15\"}]}")));
        graph.addNode(GraphNode.member("no-data", "Unknown Officer", NodeKind.OFFICER, true, null));
        for (String member : new String[] {"resigned", "ceased", "leaving", "all-resigned", "one-current", "no-data"}) {
            graph.addEdge("09390947", member, null);
        }
        return graph;
    }

    @Test
    void membersWhoHaveLeftAreRemoved() throws Exception {
        BoardGraph graph = graph();

        BoardGraph active = ActiveBoardMemberFilter.filterActive(graph, TODAY);

        assertThat(active.nodeIds()).containsExactly("09390947", "leaving", "one-current", "no-data");
        assertThat(active.edgeCount()).isEqualTo(3);
    }

    @Test
    void originalGraphIsUntouched() throws Exception {
        BoardGraph graph = graph();

        ActiveBoardMemberFilter.filterActive(graph, TODAY);

        assertThat(graph.nodeCount()).isEqualTo(7);
        assertThat(graph.edgeCount()).isEqualTo(6);
    }

    @Test
    void organisationsAreNeverRemoved() throws Exception {
        assertThat(ActiveBoardMemberFilter.inactiveMembers(graph(), TODAY))
            .containsExactly("resigned", "ceased", "all-resigned");
    }

    @Test
    void leavingDateOfFullListingIsLatestResignation() throws Exception {
        JsonNode listing = json("{\"items\": [{\"resigned_on\": \"2008-10-16\"}, {\"resigned_on\": \"2012-01-01\"}]}");
        assertThat(ActiveBoardMemberFilter.leavingDate(listing)).contains(LocalDate.of(2012, 1, 1));
        assertThat(ActiveBoardMemberFilter.leavingDate(json("{\"items\": []}"))).isEmpty();
    }
}
