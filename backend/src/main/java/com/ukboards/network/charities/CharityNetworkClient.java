package com.ukboards.network.charities;

import com.ukboards.network.graph.GraphNode;
import com.ukboards.network.graph.NodeKind;
import com.ukboards.network.model.CharityId;
import com.ukboards.network.model.CharityNetworkSettings;
import com.ukboards.network.model.CharityRecord;
import com.ukboards.network.model.RelatedCharity;
import com.ukboards.network.model.TrusteeRecord;
import com.ukboards.network.service.AbstractNetworkClient;
import com.ukboards.network.util.BoardMemberHeuristics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Builds trustee interlock networks from the Charity Commission register. Trustees are followed
 * into the other charities they sit on while branches remain.
 */
public class CharityNetworkClient extends AbstractNetworkClient<CharityId, CharityNetworkSettings, CharityRecord> {
    public static final String RUN_KIND = "charity";

    private static final Logger log = LoggerFactory.getLogger(CharityNetworkClient.class);

    private final CharityRegistry registry;

    public CharityNetworkClient(
        CharityRegistry registry,
        CharityNetworkSettings settings,
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
        return NodeKind.CHARITY_NETWORK_KINDS;
    }

    @Override
    protected Optional<CharityRecord> fetchRoot(CharityId rootId) {
        return registry.charity(rootId);
    }

    @Override
    protected void clearCache() {
        // trustee listings are not cached between runs
    }

    @Override
    protected Boolean crawl(CharityId rootId, Supplier<Optional<CharityRecord>> root) {
        CharityFrame frame = new CharityFrame(rootId, 0, null, root);
        runWorklist(frame);
        return frame.found;
    }

    /**
     * Looks up {@code name} and returns the registered number of the match whose record carries
     * {@code charityNumber}.
     */
    public Optional<CharityId> findRegisteredCharityNumber(String name, CharityId charityNumber) {
        for (CharityRecord candidate : registry.charitiesByName(name)) {
            Optional<CharityRecord> detail = registry.charity(candidate.id());
            if (detail.isEmpty()) {
                continue;
            }
            CharityId listed = CharityId.of(detail.get().raw().path("CharityNumber").asText(""));
            if (listed.equals(charityNumber)) {
                return Optional.of(detail.get().id());
            }
        }
        log.warn("No charity found with CharityNumber {} for name {}", charityNumber, name);
        return Optional.empty();
    }

    private boolean addCharity(CharityRecord charity, String expectedName) {
        if (expectedName != null && !expectedName.trim().equals(charity.name())) {
            log.warn(
                "Referral test name \"{}\" is different from \"{}\" which is associated with charity_number {}",
                expectedName.trim(),
                charity.name(),
                charity.id()
            );
        }
        log.debug("{}", charity.name());
        return graph().addNode(GraphNode.organisation(
            charity.id().value(),
            charity.name(),
            NodeKind.CHARITY,
            null,
            charity.raw()
        ));
    }

    private boolean addTrustee(CharityId charityNumber, TrusteeRecord trustee) {
        if (trustee.trusteeNumber().isEmpty()) {
            log.warn("Skipping trustee {} of charity {} without a trustee number", trustee.name(), charityNumber);
            return false;
        }
        if (!isMemberSlot(trustee.trusteeNumber())) {
            log.warn(
                "Skipping trustee {} of charity {}: id already used by a charity",
                trustee.trusteeNumber(),
                charityNumber
            );
            return false;
        }
        log.debug("{} {} {}", charityNumber, trustee.name(), trustee.trusteeNumber());
        addNode(GraphNode.member(
            trustee.trusteeNumber(),
            trustee.name(),
            NodeKind.TRUSTEE,
            BoardMemberHeuristics.isPerson(trustee.name()),
            trustee.raw()
        ));
        graph().addEdge(charityNumber.value(), trustee.trusteeNumber(), null);
        return true;
    }

    /**
     * One charity: its record, then its trustees subsidiary by subsidiary.
     */
    private final class CharityFrame implements CrawlFrame {
        private final CharityId charityNumber;
        private final int hop;
        private final String expectedName;
        private final Supplier<Optional<CharityRecord>> record;
        private CharityRecord charity;
        private int subsidiary;
        private Iterator<TrusteeRecord> trustees;
        private Boolean found;

        CharityFrame(CharityId charityNumber, int hop, String expectedName, Supplier<Optional<CharityRecord>> record) {
            this.charityNumber = charityNumber;
            this.hop = hop;
            this.expectedName = expectedName;
            this.record = record;
        }

        @Override
        public boolean advance(Deque<CrawlFrame> stack) {
            if (found == null) {
                checkHop(hop);
                Optional<CharityRecord> fetched = record.get();
                found = fetched.isPresent();
                if (fetched.isEmpty()) {
                    log.warn("No data on charity {}", charityNumber);
                    return true;
                }
                charity = fetched.get();
                addCharity(charity, expectedName);
                subsidiary = 0;
            }
            while (true) {
                if (trustees == null || !trustees.hasNext()) {
                    if (subsidiary > charity.subsidiaryNumber()) {
                        return true;
                    }
                    trustees = nextSubsidiary();
                    continue;
                }
                TrusteeRecord trustee = trustees.next();
                if (!addTrustee(charity.id(), trustee)) {
                    continue;
                }
                if (hop < getSettings().branches() && trustee.relatedCharitiesCount() > 0) {
                    stack.push(new RelatedFrame(trustee, hop));
                    return false;
                }
            }
        }

        private Iterator<TrusteeRecord> nextSubsidiary() {
            int current = subsidiary++;
            List<TrusteeRecord> listed = registry.trustees(charity.id(), current);
            if (listed.isEmpty()) {
                log.warn("No trustees for charity {} ({} subsidiary {})", charity.name(), charity.id(), current);
            }
            return listed.iterator();
        }
    }

    /**
     * The other charities a trustee sits on, expanded one at a time.
     */
    private final class RelatedFrame implements CrawlFrame {
        private final Iterator<RelatedCharity> related;
        private final int hop;
        private boolean expanding;

        RelatedFrame(TrusteeRecord trustee, int hop) {
            this.related = trustee.relatedCharities().iterator();
            this.hop = hop;
        }

        @Override
        public boolean advance(Deque<CrawlFrame> stack) {
            if (expanding) {
                graph().requireBipartite();
                expanding = false;
            }
            while (related.hasNext()) {
                RelatedCharity charity = related.next();
                if (charity.number().isEmpty() || graph().hasNode(charity.number().value())) {
                    continue;
                }
                expanding = true;
                stack.push(new CharityFrame(
                    charity.number(),
                    hop + 1,
                    charity.name(),
                    () -> registry.charity(charity.number())
                ));
                return false;
            }
            return true;
        }
    }
}
