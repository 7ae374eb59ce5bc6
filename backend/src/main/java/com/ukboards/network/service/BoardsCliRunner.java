package com.ukboards.network.service;

import com.ukboards.config.BoardsProperties;
import com.ukboards.network.charities.CharityNetworkClient;
import com.ukboards.network.companies.CompanyNetworkClient;
import com.ukboards.network.graph.BoardGraph;
import com.ukboards.network.model.CharityId;
import com.ukboards.network.model.CompanyId;
import com.ukboards.network.model.RunRecord;
import com.ukboards.network.persistence.GraphJsonStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

@Component
public class BoardsCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(BoardsCliRunner.class);

    private final BoardsProperties properties;
    private final NetworkClientFactory clientFactory;
    private final SeedListReader seedListReader;
    private final GraphJsonStore graphJsonStore;
    private final Clock clock;
    private final ConfigurableApplicationContext applicationContext;

    public BoardsCliRunner(
        BoardsProperties properties,
        NetworkClientFactory clientFactory,
        SeedListReader seedListReader,
        GraphJsonStore graphJsonStore,
        Clock clock,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.clientFactory = clientFactory;
        this.seedListReader = seedListReader;
        this.graphJsonStore = graphJsonStore;
        this.clock = clock;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        BoardsProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        List<String> seeds = cli.getSeedCsv().isBlank()
            ? seedListReader.parseSeeds(cli.getSeeds())
            : seedListReader.readColumn(Paths.get(cli.getSeedCsv()), cli.getSeedColumn());
        if (seeds.isEmpty()) {
            log.warn("No seeds configured; set ukboards.cli.seeds or ukboards.cli.seed-csv");
        } else {
            NetworkResult result = switch (cli.getRegistry().toLowerCase(Locale.ROOT)) {
                case "companies", "company" -> runCompanies(seeds, cli.isAsync());
                case "charities", "charity" -> runCharities(seeds, cli.isAsync());
                default -> throw new IllegalArgumentException("Unknown registry " + cli.getRegistry());
            };
            Path output = graphJsonStore.dataDirectory()
                .resolve(GraphJsonStore.networkFileName(cli.getOutputPrefix(), LocalDateTime.now(clock)));
            graphJsonStore.write(result.graph(), result.run(), output);
            log.info(
                "Network of {} seeds: nodes={}, edges={}, components={}",
                seeds.size(),
                result.graph().nodeCount(),
                result.graph().edgeCount(),
                result.graph().connectedComponentsCount()
            );
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    private NetworkResult runCompanies(List<String> seeds, boolean async) {
        CompanyNetworkClient client = clientFactory.companyClient(clientFactory.defaultCompanySettings());
        List<CompanyId> ids = seeds.stream().map(CompanyId::of).toList();
        BoardGraph graph = async ? client.asyncGetComposedNetwork(ids).join() : client.getComposedNetwork(ids);
        return new NetworkResult(graph, client.latestRun().orElse(null));
    }

    private NetworkResult runCharities(List<String> seeds, boolean async) {
        CharityNetworkClient client = clientFactory.charityClient(clientFactory.defaultCharitySettings());
        List<CharityId> ids = seeds.stream().map(CharityId::of).toList();
        BoardGraph graph = async ? client.asyncGetComposedNetwork(ids).join() : client.getComposedNetwork(ids);
        return new NetworkResult(graph, client.latestRun().orElse(null));
    }

    private record NetworkResult(BoardGraph graph, RunRecord run) {
    }
}
