package com.ukboards.network.companies;

import com.fasterxml.jackson.databind.JsonNode;
import com.ukboards.network.model.AppointmentListing;
import com.ukboards.network.model.CompanyId;
import com.ukboards.network.model.CompanyProfile;
import com.ukboards.network.model.ControllerEntry;
import com.ukboards.network.model.ControllerListing;
import com.ukboards.network.model.OfficerListing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Per-endpoint Companies House fetchers returning typed records.
 */
@Service
public class CompaniesHouseRegistry {
    public static final String INDIVIDUAL = "individual";
    public static final String CORPORATE_ENTITY = "corporate-entity";

    private static final Logger log = LoggerFactory.getLogger(CompaniesHouseRegistry.class);

    private final CompaniesHouseQueryService queryService;

    public CompaniesHouseRegistry(CompaniesHouseQueryService queryService) {
        this.queryService = queryService;
    }

    public Optional<CompanyProfile> company(CompanyId companyId) {
        Optional<JsonNode> company = queryService.query("/company/" + companyId.value());
        if (company.isEmpty()) {
            log.error("Querying data on company {} failed", companyId);
        }
        return company.map(json -> CompanyProfile.fromJson(companyId, json));
    }

    public Optional<OfficerListing> officers(CompanyId companyId) {
        Optional<JsonNode> officers = queryService.query("/company/" + companyId.value() + "/officers");
        if (officers.isEmpty()) {
            log.error("Error requesting officers of company {}", companyId);
        }
        return officers.map(OfficerListing::fromJson);
    }

    public Optional<AppointmentListing> appointments(String officerId) {
        Optional<JsonNode> appointments = queryService.query("/officers/" + officerId + "/appointments");
        if (appointments.isEmpty()) {
            log.error("Error requesting appointments of board member {}", officerId);
        }
        return appointments.map(AppointmentListing::fromJson);
    }

    public Optional<ControllerListing> controllers(CompanyId companyId) {
        Optional<JsonNode> controllers =
            queryService.query("/company/" + companyId.value() + "/persons-with-significant-control");
        if (controllers.isEmpty()) {
            log.error("Error requesting significant controllers from company {}", companyId);
        }
        return controllers.map(ControllerListing::fromJson);
    }

    /**
     * Fetches the detail record a control statement links to, choosing the endpoint from the shape
     * of its self link.
     */
    public Optional<JsonNode> controllerDetail(ControllerEntry controller) {
        String type = controller.linkType();
        Optional<JsonNode> detail;
        if (INDIVIDUAL.equals(type) || CORPORATE_ENTITY.equals(type)) {
            detail = queryService.query(
                "/company/" + controller.linkCompanyId()
                    + "/persons-with-significant-control/" + type + "/" + controller.controllerId()
            );
        } else {
            log.warn("Querying an unsupported significant controller type {}", controller.selfLink());
            detail = queryService.query(controller.selfLink());
        }
        if (detail.isEmpty()) {
            log.error("Error requesting data on significant controller from {}", controller.selfLink());
        }
        return detail;
    }
}
