package com.ukboards.network.model;

import com.ukboards.network.service.NegativeBranchesException;

import java.util.LinkedHashMap;
import java.util.Map;

public record CharityNetworkSettings(int branches, boolean resetCache, boolean composeQueriedNetworks)
    implements NetworkSettings {

    public CharityNetworkSettings {
        if (branches < 0) {
            throw new NegativeBranchesException(branches);
        }
    }

    public static CharityNetworkSettings ofBranches(int branches) {
        return new CharityNetworkSettings(branches, true, false);
    }

    @Override
    public Map<String, Object> parameterState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("branches", branches);
        state.put("reset_cache", resetCache);
        state.put("compose_queried_networks", composeQueriedNetworks);
        return state;
    }
}
