package com.ukboards.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ukboards")
public class BoardsProperties {
    private static final String DEFAULT_IP_CHECK_URL = "https://domains.google.com/checkip";

    private String externalIpCheckUrl = DEFAULT_IP_CHECK_URL;
    private CompaniesHouse companiesHouse = new CompaniesHouse();
    private CharityCommission charityCommission = new CharityCommission();
    private Network network = new Network();
    private Composition composition = new Composition();
    private Data data = new Data();
    private Cli cli = new Cli();

    public String getExternalIpCheckUrl() {
        return externalIpCheckUrl == null || externalIpCheckUrl.isBlank() ? DEFAULT_IP_CHECK_URL : externalIpCheckUrl;
    }

    public void setExternalIpCheckUrl(String externalIpCheckUrl) {
        this.externalIpCheckUrl = externalIpCheckUrl;
    }

    public CompaniesHouse getCompaniesHouse() {
        return companiesHouse;
    }

    public void setCompaniesHouse(CompaniesHouse companiesHouse) {
        this.companiesHouse = companiesHouse;
    }

    public CharityCommission getCharityCommission() {
        return charityCommission;
    }

    public void setCharityCommission(CharityCommission charityCommission) {
        this.charityCommission = charityCommission;
    }

    public Network getNetwork() {
        return network;
    }

    public void setNetwork(Network network) {
        this.network = network;
    }

    public Composition getComposition() {
        return composition;
    }

    public void setComposition(Composition composition) {
        this.composition = composition;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class CompaniesHouse {
        public static final int MAX_ITEMS_PER_PAGE = 50;

        private String url = "https://api.companieshouse.gov.uk";
        private String apiKey = "";
        private String apiKeyEnvName = "COMPANIES_HOUSE_KEY";
        private String apiKeyPath = ".env";
        private int maxTrials = 6;
        private int serverErrorTrials = 2;
        private int retrySleepMs = 60_000;
        private int overloadSleepMs = 60_000;
        private int itemsPerPage = MAX_ITEMS_PER_PAGE;
        private int requestTimeoutSeconds = 20;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = stripTrailingSlash(url);
        }

        public String getApiKey() {
            return apiKey == null ? "" : apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey == null ? "" : apiKey.trim();
        }

        public String getApiKeyEnvName() {
            return apiKeyEnvName;
        }

        public void setApiKeyEnvName(String apiKeyEnvName) {
            this.apiKeyEnvName = apiKeyEnvName;
        }

        public String getApiKeyPath() {
            return apiKeyPath;
        }

        public void setApiKeyPath(String apiKeyPath) {
            this.apiKeyPath = apiKeyPath;
        }

        public int getMaxTrials() {
            return Math.max(1, maxTrials);
        }

        public void setMaxTrials(int maxTrials) {
            this.maxTrials = Math.max(1, maxTrials);
        }

        public int getServerErrorTrials() {
            return Math.max(1, Math.min(serverErrorTrials, getMaxTrials()));
        }

        public void setServerErrorTrials(int serverErrorTrials) {
            this.serverErrorTrials = Math.max(1, serverErrorTrials);
        }

        public int getRetrySleepMs() {
            return Math.max(0, retrySleepMs);
        }

        public void setRetrySleepMs(int retrySleepMs) {
            this.retrySleepMs = Math.max(0, retrySleepMs);
        }

        public int getOverloadSleepMs() {
            return Math.max(0, overloadSleepMs);
        }

        public void setOverloadSleepMs(int overloadSleepMs) {
            this.overloadSleepMs = Math.max(0, overloadSleepMs);
        }

        public int getItemsPerPage() {
            return clampPageSize(itemsPerPage);
        }

        public void setItemsPerPage(int itemsPerPage) {
            this.itemsPerPage = clampPageSize(itemsPerPage);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        private static int clampPageSize(int value) {
            return Math.max(1, Math.min(MAX_ITEMS_PER_PAGE, value));
        }
    }

    public static class CharityCommission {
        private String url = "https://apps.charitycommission.gov.uk/Showcharity/API/SearchCharitiesV1/SearchCharitiesV1.asmx";
        private String namespace = "http://www.charitycommission.gov.uk/";
        private String apiKey = "";
        private String apiKeyEnvName = "CHARITY_COMMISSION_KEY";
        private int requestTimeoutSeconds = 30;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public String getApiKey() {
            return apiKey == null ? "" : apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey == null ? "" : apiKey.trim();
        }

        public String getApiKeyEnvName() {
            return apiKeyEnvName;
        }

        public void setApiKeyEnvName(String apiKeyEnvName) {
            this.apiKeyEnvName = apiKeyEnvName;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    /**
     * Default crawl settings used by the command line runner and as fallbacks for API requests.
     */
    public static class Network {
        private int branches = 0;
        private boolean includeSignificantControllers = false;
        private boolean includeOfficers = true;
        private boolean includeEdgeData = false;
        private boolean enforceMissingTies = false;
        private boolean excludeNonActiveCompanies = false;
        private boolean excludeResignedBoardMembers = false;
        private boolean excludeCeasedControllers = false;

        public int getBranches() {
            return branches;
        }

        public void setBranches(int branches) {
            this.branches = branches;
        }

        public boolean isIncludeSignificantControllers() {
            return includeSignificantControllers;
        }

        public void setIncludeSignificantControllers(boolean includeSignificantControllers) {
            this.includeSignificantControllers = includeSignificantControllers;
        }

        public boolean isIncludeOfficers() {
            return includeOfficers;
        }

        public void setIncludeOfficers(boolean includeOfficers) {
            this.includeOfficers = includeOfficers;
        }

        public boolean isIncludeEdgeData() {
            return includeEdgeData;
        }

        public void setIncludeEdgeData(boolean includeEdgeData) {
            this.includeEdgeData = includeEdgeData;
        }

        public boolean isEnforceMissingTies() {
            return enforceMissingTies;
        }

        public void setEnforceMissingTies(boolean enforceMissingTies) {
            this.enforceMissingTies = enforceMissingTies;
        }

        public boolean isExcludeNonActiveCompanies() {
            return excludeNonActiveCompanies;
        }

        public void setExcludeNonActiveCompanies(boolean excludeNonActiveCompanies) {
            this.excludeNonActiveCompanies = excludeNonActiveCompanies;
        }

        public boolean isExcludeResignedBoardMembers() {
            return excludeResignedBoardMembers;
        }

        public void setExcludeResignedBoardMembers(boolean excludeResignedBoardMembers) {
            this.excludeResignedBoardMembers = excludeResignedBoardMembers;
        }

        public boolean isExcludeCeasedControllers() {
            return excludeCeasedControllers;
        }

        public void setExcludeCeasedControllers(boolean excludeCeasedControllers) {
            this.excludeCeasedControllers = excludeCeasedControllers;
        }
    }

    public static class Composition {
        private int prefetchConcurrency = 4;

        public int getPrefetchConcurrency() {
            return Math.max(1, prefetchConcurrency);
        }

        public void setPrefetchConcurrency(int prefetchConcurrency) {
            this.prefetchConcurrency = Math.max(1, prefetchConcurrency);
        }
    }

    public static class Data {
        private String jsonPath = "data/json";

        public String getJsonPath() {
            return jsonPath;
        }

        public void setJsonPath(String jsonPath) {
            this.jsonPath = jsonPath;
        }
    }

    public static class Cli {
        private boolean run;
        private String registry = "companies";
        private String seeds = "";
        private String seedCsv = "";
        private String seedColumn = "company_number";
        private boolean async = false;
        private String outputPrefix = "ukboards";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getRegistry() {
            return registry;
        }

        public void setRegistry(String registry) {
            this.registry = registry;
        }

        public String getSeeds() {
            return seeds == null ? "" : seeds;
        }

        public void setSeeds(String seeds) {
            this.seeds = seeds;
        }

        public String getSeedCsv() {
            return seedCsv == null ? "" : seedCsv;
        }

        public void setSeedCsv(String seedCsv) {
            this.seedCsv = seedCsv;
        }

        public String getSeedColumn() {
            return seedColumn;
        }

        public void setSeedColumn(String seedColumn) {
            this.seedColumn = seedColumn;
        }

        public boolean isAsync() {
            return async;
        }

        public void setAsync(boolean async) {
            this.async = async;
        }

        public String getOutputPrefix() {
            return outputPrefix == null || outputPrefix.isBlank() ? "ukboards" : outputPrefix;
        }

        public void setOutputPrefix(String outputPrefix) {
            this.outputPrefix = outputPrefix;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
