package com.ukboards.network.companies;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ukboards.network.graph.BoardGraph;
import com.ukboards.network.graph.GraphNode;
import com.ukboards.network.graph.NodeKind;
import com.ukboards.network.model.Appointment;
import com.ukboards.network.model.AppointmentListing;
import com.ukboards.network.model.CompanyId;
import com.ukboards.network.model.CompanyNetworkSettings;
import com.ukboards.network.model.CompanyProfile;
import com.ukboards.network.model.ControllerEntry;
import com.ukboards.network.model.ControllerListing;
import com.ukboards.network.model.OfficerEntry;
import com.ukboards.network.model.OfficerListing;
import com.ukboards.network.service.AbstractNetworkClient;
import com.ukboards.network.util.BoardMemberHeuristics;
import com.ukboards.network.util.CompanyCategories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Builds the board interlock network of Companies House companies, their officers and, optionally,
 * their significant controllers.
 *
 * <p>A crawl is a depth-first walk bounded by {@code branches}: the root company and its board are
 * hop 0, and each board member's other companies are crawled at the next hop while hops remain.
 */
public class CompanyNetworkClient extends AbstractNetworkClient<CompanyId, CompanyNetworkSettings, CompanyProfile> {
    public static final String RUN_KIND = "company";

    private static final Logger log = LoggerFactory.getLogger(CompanyNetworkClient.class);

    private final CompaniesHouseRegistry registry;
    private final AppointmentCache cache = new AppointmentCache();

    public CompanyNetworkClient(
        CompaniesHouseRegistry registry,
        CompanyNetworkSettings settings,
        Clock clock,
        ExecutorService executor
    ) {
        super(settings, clock, executor);
        this.registry = registry;
    }

    @Override
    protected String runKind() {
        return RUN_KIND;
    }

    @Override
    protected Collection<NodeKind> networkKinds() {
        return NodeKind.COMPANY_NETWORK_KINDS;
    }

    @Override
    protected Optional<CompanyProfile> fetchRoot(CompanyId rootId) {
        return registry.company(rootId);
    }

    @Override
    protected void clearCache() {
        cache.clear();
    }

    synchronized AppointmentCache cache() {
        return cache;
    }

    @Override
    protected Boolean crawl(CompanyId rootId, Supplier<Optional<CompanyProfile>> root) {
        log.debug("Querying board network from {}", rootId);
        runWorklist(new OrganisationFrame(rootId, 0, root));
        return null;
    }

    private List<BoardTie> openOrganisation(CompanyId companyId, Optional<CompanyProfile> fetched) {
        CompanyNetworkSettings settings = getSettings();
        if (fetched.isEmpty()) {
            log.warn("Skipping company {}: no record returned", companyId);
            return List.of();
        }
        CompanyProfile profile = fetched.get();
        if (settings.excludeNonActiveCompanies() && !profile.isActive()) {
            log.warn(
                "Excluding company {} because status is {}. Company name: {}",
                companyId,
                profile.status(),
                profile.name()
            );
            return List.of();
        }
        String category = CompanyCategories.categoryOf(companyId);

        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.set("company", profile.raw());
        List<BoardTie> ties = new ArrayList<>();
        if (settings.includeOfficers() && profile.hasOfficersLink()) {
            Optional<OfficerListing> officers = registry.officers(companyId);
            data.set("officers", officers.map(OfficerListing::raw).orElse(null));
            officers.ifPresent(listing -> collectOfficers(companyId, listing, settings, ties));
        }
        if (settings.includeSignificantControllers()) {
            Optional<ControllerListing> controllers = registry.controllers(companyId);
            data.set("significant_controllers", controllers.map(ControllerListing::raw).orElse(null));
            controllers.ifPresent(listing -> collectControllers(companyId, listing, settings, ties));
        }
        log.debug("{} {}", companyId, profile.name());
        graph().addNode(GraphNode.organisation(companyId.value(), profile.name(), NodeKind.COMPANY, category, data));
        return ties;
    }

    private void collectOfficers(
        CompanyId companyId,
        OfficerListing listing,
        CompanyNetworkSettings settings,
        List<BoardTie> ties
    ) {
        for (OfficerEntry officer : listing.items()) {
            if (officer.officerId().isBlank()) {
                log.warn("Skipping officer {} of company {} without an appointments link", officer.name(), companyId);
                continue;
            }
            if (settings.excludeResignedBoardMembers()
                && BoardMemberHeuristics.isInactive(officer.raw(), BoardMemberHeuristics.RESIGNED_ON, today())) {
                log.debug(
                    "Skipping officer {} because of resignation on {}",
                    officer.name(),
                    officer.raw().path(BoardMemberHeuristics.RESIGNED_ON).asText()
                );
                continue;
            }
            log.debug("{} {} {}", companyId, officer.name(), officer.officerId());
            ties.add(BoardTie.officer(officer));
        }
    }

    private void collectControllers(
        CompanyId companyId,
        ControllerListing listing,
        CompanyNetworkSettings settings,
        List<BoardTie> ties
    ) {
        for (ControllerEntry controller : listing.items()) {
            if (controller.controllerId().isBlank()) {
                log.warn("Skipping controller {} of company {} without a self link", controller.name(), companyId);
                continue;
            }
            if (settings.excludeCeasedControllers()
                && BoardMemberHeuristics.isInactive(controller.raw(), BoardMemberHeuristics.CEASED_ON, today())) {
                log.debug(
                    "Skipping controller {} because they ceased on {}",
                    controller.name(),
                    controller.raw().path(BoardMemberHeuristics.CEASED_ON).asText()
                );
                continue;
            }
            log.debug("{} {} {}", companyId, controller.name(), controller.controllerId());
            ties.add(BoardTie.controller(controller));
        }
    }

    /**
     * Adds the member node if new and its edge to {@code companyId}.
     *
     * @return false when the tie could not be recorded
     */
    private boolean attach(BoardTie tie, CompanyId companyId) {
        BoardGraph graph = graph();
        String memberId = tie.memberId();
        if (!isMemberSlot(memberId)) {
            log.warn("Skipping board member {} of company {}: id already used by a company", memberId, companyId);
            return false;
        }
        JsonNode edgeData;
        if (tie.officer() != null) {
            if (!graph.hasNode(memberId)) {
                addOfficer(tie.officer(), companyId);
            }
            edgeData = tie.officer().raw();
            if (getSettings().includeEdgeData()) {
                edgeData = cache.get(memberId, companyId).orElse(edgeData);
            }
        } else {
            if (!graph.hasNode(memberId)) {
                addController(tie.controller());
            }
            cache.put(memberId, companyId, tie.controller().raw());
            edgeData = tie.controller().raw();
        }
        graph.addEdge(companyId.value(), memberId, edgeData);
        return true;
    }

    private void addOfficer(OfficerEntry officer, CompanyId companyId) {
        String officerId = officer.officerId();
        Optional<AppointmentListing> appointments = registry.appointments(officerId);
        if (appointments.isPresent() && appointments.get().hasItems()) {
            boolean excludeResigned = getSettings().excludeResignedBoardMembers();
            int resigned = 0;
            cache.register(officerId);
            for (Appointment appointment : appointments.get().items()) {
                if (excludeResigned && appointment.resigned()) {
                    resigned++;
                    continue;
                }
                cache.put(officerId, appointment.companyId(), appointment.raw());
            }
            if (excludeResigned) {
                log.debug("Skipping {} resigned board positions for officer {}", resigned, officerId);
            }
        }
        String name = officerName(officerId, companyId, officer);
        graph().addNode(GraphNode.member(
            officerId,
            name,
            NodeKind.OFFICER,
            BoardMemberHeuristics.isPerson(name),
            appointments.map(AppointmentListing::raw).orElse(null)
        ));
    }

    private void addController(ControllerEntry controller) {
        Optional<JsonNode> detail = registry.controllerDetail(controller);
        boolean individual = BoardMemberHeuristics.isIndividualControllerLink(controller.selfLink())
            && BoardMemberHeuristics.isPerson(controller.name());
        graph().addNode(GraphNode.member(
            controller.controllerId(),
            controller.name(),
            NodeKind.CONTROLLER,
            individual,
            detail.orElse(null)
        ));
    }

    /**
     * Name recorded on the appointment to this company, else the name in the company's officer
     * listing, else blank.
     */
    String officerName(String officerId, CompanyId companyId, OfficerEntry officer) {
        Optional<JsonNode> appointment = cache.get(officerId, companyId);
        if (appointment.isPresent() && appointment.get().hasNonNull("name")) {
            String cached = appointment.get().get("name").asText();
            if (!cached.isBlank()) {
                return cached;
            }
        } else if (appointment.isEmpty() || !appointment.get().has("name")) {
            log.warn("No 'name' data available for officer {} ({}) in appointments_cache", officer.name(), officerId);
        }
        if (!officer.nameListed()) {
            log.warn("No 'name' data available for officer {} for company {}", officerId, companyId);
            return "";
        }
        if (officer.name() == null || officer.name().isBlank()) {
            log.warn("Null name listed for officer {} from company {}", officerId, companyId);
            return "";
        }
        return officer.name();
    }

    private void enforceTie(String memberId, CompanyId companyId) {
        BoardGraph graph = graph();
        if (!getSettings().enforceMissingTies() || !graph.hasNode(companyId.value())) {
            return;
        }
        if (!graph.hasEdge(memberId, companyId.value())) {
            log.warn("Enforcing possible tie between {} and {}", memberId, companyId);
            graph.addEdge(companyId.value(), memberId, null);
        }
    }

    private record BoardTie(OfficerEntry officer, ControllerEntry controller) {

        static BoardTie officer(OfficerEntry officer) {
            return new BoardTie(officer, null);
        }

        static BoardTie controller(ControllerEntry controller) {
            return new BoardTie(null, controller);
        }

        String memberId() {
            return officer != null ? officer.officerId() : controller.controllerId();
        }
    }

    /**
     * Expands one company: opens it on the first step, then attaches its board one member at a
     * time, descending into each member's other companies while hops remain.
     */
    private final class OrganisationFrame implements CrawlFrame {
        private final CompanyId companyId;
        private final int hop;
        private final Supplier<Optional<CompanyProfile>> profile;
        private Iterator<BoardTie> ties;

        OrganisationFrame(CompanyId companyId, int hop, Supplier<Optional<CompanyProfile>> profile) {
            this.companyId = companyId;
            this.hop = hop;
            this.profile = profile;
        }

        @Override
        public boolean advance(Deque<CrawlFrame> stack) {
            if (ties == null) {
                checkHop(hop);
                ties = openOrganisation(companyId, profile.get()).iterator();
            }
            while (ties.hasNext()) {
                BoardTie tie = ties.next();
                if (!attach(tie, companyId)) {
                    continue;
                }
                if (hop < getSettings().branches()) {
                    stack.push(new BranchFrame(tie.memberId(), hop));
                    return false;
                }
            }
            graph().requireBipartite();
            return true;
        }
    }

    /**
     * Crawls the companies a board member is tied to that are not yet in the graph, one per step.
     */
    private final class BranchFrame implements CrawlFrame {
        private final String memberId;
        private final int hop;
        private Iterator<CompanyId> related;
        private CompanyId pending;

        BranchFrame(String memberId, int hop) {
            this.memberId = memberId;
            this.hop = hop;
        }

        @Override
        public boolean advance(Deque<CrawlFrame> stack) {
            if (related == null) {
                Optional<List<CompanyId>> companies = cache.relatedCompanies(memberId);
                if (companies.isEmpty()) {
                    log.warn("No branch data from {}", memberId);
                    return true;
                }
                related = companies.get().iterator();
            }
            if (pending != null) {
                enforceTie(memberId, pending);
                pending = null;
            }
            while (related.hasNext()) {
                CompanyId companyId = related.next();
                if (companyId.isEmpty() || graph().hasNode(companyId.value())) {
                    continue;
                }
                pending = companyId;
                stack.push(new OrganisationFrame(companyId, hop + 1, () -> registry.company(companyId)));
                return false;
            }
            return true;
        }
    }
}
