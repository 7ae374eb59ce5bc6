package com.ukboards.network.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ukboards.network.charities.CharityNetworkClient;
import com.ukboards.network.companies.CompanyNetworkClient;
import com.ukboards.network.graph.BoardGraph;
import com.ukboards.network.model.CharityId;
import com.ukboards.network.model.CharityNetworkSettings;
import com.ukboards.network.model.CompanyId;
import com.ukboards.network.model.CompanyNetworkSettings;
import com.ukboards.network.persistence.GraphJsonStore;
import com.ukboards.network.service.NetworkClientFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Builds a network for one seed per request and returns it as node-link JSON with its run record.
 * Unset parameters fall back to {@code ukboards.network}.
 */
@RestController
@RequestMapping("/api/networks")
public class NetworkController {
    private final NetworkClientFactory clientFactory;
    private final GraphJsonStore graphJsonStore;

    public NetworkController(NetworkClientFactory clientFactory, GraphJsonStore graphJsonStore) {
        this.clientFactory = clientFactory;
        this.graphJsonStore = graphJsonStore;
    }

    @GetMapping("/companies/{companyId}")
    public ObjectNode companyNetwork(
        @PathVariable("companyId") String companyId,
        @RequestParam(name = "branches", required = false) Integer branches,
        @RequestParam(name = "includeSignificantControllers", required = false) Boolean includeSignificantControllers,
        @RequestParam(name = "includeOfficers", required = false) Boolean includeOfficers,
        @RequestParam(name = "includeEdgeData", required = false) Boolean includeEdgeData,
        @RequestParam(name = "enforceMissingTies", required = false) Boolean enforceMissingTies,
        @RequestParam(name = "excludeNonActiveCompanies", required = false) Boolean excludeNonActiveCompanies,
        @RequestParam(name = "excludeResignedBoardMembers", required = false) Boolean excludeResignedBoardMembers,
        @RequestParam(name = "excludeCeasedControllers", required = false) Boolean excludeCeasedControllers
    ) {
        CompanyNetworkSettings defaults = clientFactory.defaultCompanySettings();
        CompanyNetworkSettings settings = defaults.toBuilder()
            .branches(branches == null ? defaults.branches() : branches)
            .includeSignificantControllers(orDefault(includeSignificantControllers, defaults.includeSignificantControllers()))
            .includeOfficers(orDefault(includeOfficers, defaults.includeOfficers()))
            .includeEdgeData(orDefault(includeEdgeData, defaults.includeEdgeData()))
            .enforceMissingTies(orDefault(enforceMissingTies, defaults.enforceMissingTies()))
            .excludeNonActiveCompanies(orDefault(excludeNonActiveCompanies, defaults.excludeNonActiveCompanies()))
            .excludeResignedBoardMembers(orDefault(excludeResignedBoardMembers, defaults.excludeResignedBoardMembers()))
            .excludeCeasedControllers(orDefault(excludeCeasedControllers, defaults.excludeCeasedControllers()))
            .build();
        CompanyNetworkClient client = clientFactory.companyClient(settings);
        BoardGraph graph = client.getNetwork(CompanyId.of(companyId));
        return graphJsonStore.toNodeLink(graph, client.latestRun().orElse(null));
    }

    @GetMapping("/charities/{charityNumber}")
    public ObjectNode charityNetwork(
        @PathVariable("charityNumber") String charityNumber,
        @RequestParam(name = "branches", required = false) Integer branches
    ) {
        CharityNetworkSettings settings = branches == null
            ? clientFactory.defaultCharitySettings()
            : CharityNetworkSettings.ofBranches(branches);
        CharityNetworkClient client = clientFactory.charityClient(settings);
        BoardGraph graph = client.getNetwork(CharityId.of(charityNumber));
        return graphJsonStore.toNodeLink(graph, client.latestRun().orElse(null));
    }

    private boolean orDefault(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }
}
