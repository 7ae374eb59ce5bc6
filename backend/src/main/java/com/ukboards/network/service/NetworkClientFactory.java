package com.ukboards.network.service;

import com.ukboards.config.BoardsProperties;
import com.ukboards.network.charities.CharityNetworkClient;
import com.ukboards.network.charities.CharityRegistry;
import com.ukboards.network.companies.CompaniesHouseRegistry;
import com.ukboards.network.companies.CompanyNetworkClient;
import com.ukboards.network.model.CharityNetworkSettings;
import com.ukboards.network.model.CompanyNetworkSettings;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Creates network clients wired to the configured registries. Each client owns its own graph and
 * cache, so callers that want separate networks ask for separate clients.
 */
@Service
public class NetworkClientFactory {
    private final BoardsProperties.Network defaults;
    private final CompaniesHouseRegistry companiesHouseRegistry;
    private final CharityRegistry charityRegistry;
    private final Clock clock;
    private final ExecutorService prefetchExecutor;

    public NetworkClientFactory(
        BoardsProperties properties,
        CompaniesHouseRegistry companiesHouseRegistry,
        CharityRegistry charityRegistry,
        Clock clock,
        @Qualifier("prefetchExecutor") ExecutorService prefetchExecutor
    ) {
        this.defaults = properties.getNetwork();
        this.companiesHouseRegistry = companiesHouseRegistry;
        this.charityRegistry = charityRegistry;
        this.clock = clock;
        this.prefetchExecutor = prefetchExecutor;
    }

    public CompanyNetworkSettings defaultCompanySettings() {
        return CompanyNetworkSettings.builder()
            .branches(defaults.getBranches())
            .includeSignificantControllers(defaults.isIncludeSignificantControllers())
            .includeOfficers(defaults.isIncludeOfficers())
            .includeEdgeData(defaults.isIncludeEdgeData())
            .enforceMissingTies(defaults.isEnforceMissingTies())
            .excludeNonActiveCompanies(defaults.isExcludeNonActiveCompanies())
            .excludeResignedBoardMembers(defaults.isExcludeResignedBoardMembers())
            .excludeCeasedControllers(defaults.isExcludeCeasedControllers())
            .build();
    }

    public CharityNetworkSettings defaultCharitySettings() {
        return CharityNetworkSettings.ofBranches(defaults.getBranches());
    }

    public CompanyNetworkClient companyClient(CompanyNetworkSettings settings) {
        return new CompanyNetworkClient(companiesHouseRegistry, settings, clock, prefetchExecutor);
    }

    public CharityNetworkClient charityClient(CharityNetworkSettings settings) {
        return new CharityNetworkClient(charityRegistry, settings, clock, prefetchExecutor);
    }
}
