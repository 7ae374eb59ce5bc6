package com.ukboards.network.model;

import com.ukboards.network.service.NegativeBranchesException;

import java.util.LinkedHashMap;
import java.util.Map;

public record CompanyNetworkSettings(
    int branches,
    boolean includeSignificantControllers,
    boolean includeOfficers,
    boolean includeEdgeData,
    boolean enforceMissingTies,
    boolean excludeNonActiveCompanies,
    boolean excludeResignedBoardMembers,
    boolean excludeCeasedControllers,
    boolean resetCache,
    boolean composeQueriedNetworks
) implements NetworkSettings {

    public CompanyNetworkSettings {
        if (branches < 0) {
            throw new NegativeBranchesException(branches);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .branches(branches)
            .includeSignificantControllers(includeSignificantControllers)
            .includeOfficers(includeOfficers)
            .includeEdgeData(includeEdgeData)
            .enforceMissingTies(enforceMissingTies)
            .excludeNonActiveCompanies(excludeNonActiveCompanies)
            .excludeResignedBoardMembers(excludeResignedBoardMembers)
            .excludeCeasedControllers(excludeCeasedControllers)
            .resetCache(resetCache)
            .composeQueriedNetworks(composeQueriedNetworks);
    }

    @Override
    public Map<String, Object> parameterState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("branches", branches);
        state.put("include_significant_controllers", includeSignificantControllers);
        state.put("include_officers", includeOfficers);
        state.put("include_edge_data", includeEdgeData);
        state.put("enforce_missing_ties", enforceMissingTies);
        state.put("exclude_non_active_companies", excludeNonActiveCompanies);
        state.put("exclude_resigned_board_members", excludeResignedBoardMembers);
        state.put("exclude_ceased_controllers", excludeCeasedControllers);
        state.put("reset_cache", resetCache);
        state.put("compose_queried_networks", composeQueriedNetworks);
        return state;
    }

    public static class Builder {
        private int branches = 0;
        private boolean includeSignificantControllers = false;
        private boolean includeOfficers = true;
        private boolean includeEdgeData = false;
        private boolean enforceMissingTies = false;
        private boolean excludeNonActiveCompanies = false;
        private boolean excludeResignedBoardMembers = false;
        private boolean excludeCeasedControllers = false;
        private boolean resetCache = true;
        private boolean composeQueriedNetworks = false;

        public Builder branches(int branches) {
            this.branches = branches;
            return this;
        }

        public Builder includeSignificantControllers(boolean value) {
            this.includeSignificantControllers = value;
            return this;
        }

        public Builder includeOfficers(boolean value) {
            this.includeOfficers = value;
            return this;
        }

        public Builder includeEdgeData(boolean value) {
            this.includeEdgeData = value;
            return this;
        }

        public Builder enforceMissingTies(boolean value) {
            this.enforceMissingTies = value;
            return this;
        }

        public Builder excludeNonActiveCompanies(boolean value) {
            this.excludeNonActiveCompanies = value;
            return this;
        }

        public Builder excludeResignedBoardMembers(boolean value) {
            this.excludeResignedBoardMembers = value;
            return this;
        }

        public Builder excludeCeasedControllers(boolean value) {
            this.excludeCeasedControllers = value;
            return this;
        }

        public Builder resetCache(boolean value) {
            this.resetCache = value;
            return this;
        }

        public Builder composeQueriedNetworks(boolean value) {
            this.composeQueriedNetworks = value;
            return this;
        }

        public CompanyNetworkSettings build() {
            return new CompanyNetworkSettings(
                branches,
                includeSignificantControllers,
                includeOfficers,
                includeEdgeData,
                enforceMissingTies,
                excludeNonActiveCompanies,
                excludeResignedBoardMembers,
                excludeCeasedControllers,
                resetCache,
                composeQueriedNetworks
            );
        }
    }
}
