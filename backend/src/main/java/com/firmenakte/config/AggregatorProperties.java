package com.firmenakte.config;

import com.firmenakte.aggregate.model.FailureKind;
import com.firmenakte.aggregate.model.SourceId;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@ConfigurationProperties(prefix = "aggregator")
public class AggregatorProperties {
    private static final String DEFAULT_USER_AGENT = "firmenakte/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 500;
    private int globalConcurrency = 8;
    private int sourceConcurrency = 8;
    private int requestTimeoutSeconds = 20;
    private Run run = new Run();
    private Map<String, Source> sources = new LinkedHashMap<>();
    private Merge merge = new Merge();
    private Session session = new Session();
    private Artifacts artifacts = new Artifacts();
    private Data data = new Data();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getSourceConcurrency() {
        return Math.max(SourceId.values().length, sourceConcurrency);
    }

    public void setSourceConcurrency(int sourceConcurrency) {
        this.sourceConcurrency = sourceConcurrency;
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    public void setSources(Map<String, Source> sources) {
        this.sources = sources == null ? new LinkedHashMap<>() : sources;
    }

    public Source source(SourceId sourceId) {
        Source configured = sources.get(sourceId.key());
        if (configured == null) {
            configured = new Source();
            sources.put(sourceId.key(), configured);
        }
        return configured;
    }

    public Merge getMerge() {
        return merge;
    }

    public void setMerge(Merge merge) {
        this.merge = merge;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public Artifacts getArtifacts() {
        return artifacts;
    }

    public void setArtifacts(Artifacts artifacts) {
        this.artifacts = artifacts;
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

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Run {
        private int deadlineSeconds = 180;
        private int staleRunMinutes = 60;

        public int getDeadlineSeconds() {
            return Math.max(1, deadlineSeconds);
        }

        public void setDeadlineSeconds(int deadlineSeconds) {
            this.deadlineSeconds = Math.max(1, deadlineSeconds);
        }

        public int getStaleRunMinutes() {
            return Math.max(1, staleRunMinutes);
        }

        public void setStaleRunMinutes(int staleRunMinutes) {
            this.staleRunMinutes = Math.max(1, staleRunMinutes);
        }
    }

    public static class Source {
        private boolean enabled = true;
        private String baseUrl;
        private int timeoutSeconds = 90;
        private int maxAttempts = 3;
        private String backoff = "exponential";
        private int baseDelayMs = 1000;
        private int maxDelayMs = 15000;
        private boolean jitter = true;
        private Set<FailureKind> retryableKinds = EnumSet.of(
            FailureKind.TIMEOUT,
            FailureKind.RATE_LIMITED,
            FailureKind.TRANSIENT_NETWORK
        );

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public String getBackoff() {
            return backoff == null ? "exponential" : backoff.trim().toLowerCase(Locale.ROOT);
        }

        public void setBackoff(String backoff) {
            this.backoff = backoff;
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }

        public Set<FailureKind> getRetryableKinds() {
            return retryableKinds;
        }

        public void setRetryableKinds(Set<FailureKind> retryableKinds) {
            this.retryableKinds = retryableKinds == null || retryableKinds.isEmpty()
                ? EnumSet.noneOf(FailureKind.class)
                : EnumSet.copyOf(retryableKinds);
        }
    }

    public static class Merge {
        private Map<String, Integer> defaultRanks = new LinkedHashMap<>(Map.of(
            "handelsregister", 1,
            "unternehmensregister", 2,
            "northdata", 3,
            "linkedin", 4
        ));
        private Map<String, Map<String, Integer>> groupRanks = new LinkedHashMap<>();
        private Map<String, Map<String, Integer>> fieldRanks = new LinkedHashMap<>();

        public Map<String, Integer> getDefaultRanks() {
            return defaultRanks;
        }

        public void setDefaultRanks(Map<String, Integer> defaultRanks) {
            this.defaultRanks = defaultRanks == null ? new LinkedHashMap<>() : defaultRanks;
        }

        public Map<String, Map<String, Integer>> getGroupRanks() {
            return groupRanks;
        }

        public void setGroupRanks(Map<String, Map<String, Integer>> groupRanks) {
            this.groupRanks = groupRanks == null ? new LinkedHashMap<>() : groupRanks;
        }

        public Map<String, Map<String, Integer>> getFieldRanks() {
            return fieldRanks;
        }

        public void setFieldRanks(Map<String, Map<String, Integer>> fieldRanks) {
            this.fieldRanks = fieldRanks == null ? new LinkedHashMap<>() : fieldRanks;
        }
    }

    public static class Session {
        private String directory = "./data/sessions";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Artifacts {
        private boolean enabled = true;
        private String directory = "./data/artifacts";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Data {
        private String companiesCsv = "./data/companies.csv";

        public String getCompaniesCsv() {
            return companiesCsv;
        }

        public void setCompaniesCsv(String companiesCsv) {
            this.companiesCsv = companiesCsv;
        }
    }

    public static class Cli {
        private boolean run;
        private String companyName = "";
        private String registernummer = "";
        private String ustIdnr = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getCompanyName() {
            return companyName;
        }

        public void setCompanyName(String companyName) {
            this.companyName = companyName;
        }

        public String getRegisternummer() {
            return registernummer;
        }

        public void setRegisternummer(String registernummer) {
            this.registernummer = registernummer;
        }

        public String getUstIdnr() {
            return ustIdnr;
        }

        public void setUstIdnr(String ustIdnr) {
            this.ustIdnr = ustIdnr;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
