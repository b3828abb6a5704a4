package io.intellixity.querywall.service.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "querywall")
public class QueryWallProperties {
  private final Store rowStore = new Store();
  private final Store columnar = new Store();
  private final Executor executor = new Executor();
  private final Guardrails guardrails = new Guardrails();
  private final Cache cache = new Cache();
  private final RateLimit rateLimit = new RateLimit();
  private final Warmer warmer = new Warmer();

  public Store getRowStore() { return rowStore; }
  public Store getColumnar() { return columnar; }
  public Executor getExecutor() { return executor; }
  public Guardrails getGuardrails() { return guardrails; }
  public Cache getCache() { return cache; }
  public RateLimit getRateLimit() { return rateLimit; }
  public Warmer getWarmer() { return warmer; }

  /** JDBC settings of one store. The columnar store is optional: leave {@code jdbcUrl} empty to disable it. */
  public static class Store {
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema;
    private int maximumPoolSize = 10;
    private Duration connectionTimeout = Duration.ofSeconds(5);

    public boolean isConfigured() { return jdbcUrl != null && !jdbcUrl.isBlank(); }

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    public Duration getConnectionTimeout() { return connectionTimeout; }
    public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
  }

  public static class Executor {
    private Duration timeout = Duration.ofSeconds(30);
    private int maxRows = 10_000;

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
    public int getMaxRows() { return maxRows; }
    public void setMaxRows(int maxRows) { this.maxRows = maxRows; }
  }

  public static class Guardrails {
    private String tenantColumn = "company_id";
    private int maxLimit = 10_000;
    private int maxNestingDepth = 3;
    private int maxTimeWindowDays = 730;

    public String getTenantColumn() { return tenantColumn; }
    public void setTenantColumn(String tenantColumn) { this.tenantColumn = tenantColumn; }
    public int getMaxLimit() { return maxLimit; }
    public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }
    public int getMaxNestingDepth() { return maxNestingDepth; }
    public void setMaxNestingDepth(int maxNestingDepth) { this.maxNestingDepth = maxNestingDepth; }
    public int getMaxTimeWindowDays() { return maxTimeWindowDays; }
    public void setMaxTimeWindowDays(int maxTimeWindowDays) { this.maxTimeWindowDays = maxTimeWindowDays; }
  }

  public static class Cache {
    /** When set, entries, locks and counters live on this Redis server instead of in process. */
    private String redisUrl;
    private int maxEntries = 100_000;
    private DataSize maxMemory = DataSize.ofMegabytes(256);
    private Duration defaultTtl = Duration.ofHours(1);
    private Duration lockTtl = Duration.ofSeconds(30);
    private Duration lockRetryDelay = Duration.ofMillis(100);
    private int lockMaxRetries = 50;
    private Duration queryStatsTtl = Duration.ofDays(7);
    private int topQueries = 10;

    public String getRedisUrl() { return redisUrl; }
    public void setRedisUrl(String redisUrl) { this.redisUrl = redisUrl; }
    public DataSize getMaxMemory() { return maxMemory; }
    public void setMaxMemory(DataSize maxMemory) { this.maxMemory = maxMemory; }
    public int getMaxEntries() { return maxEntries; }
    public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    public Duration getDefaultTtl() { return defaultTtl; }
    public void setDefaultTtl(Duration defaultTtl) { this.defaultTtl = defaultTtl; }
    public Duration getLockTtl() { return lockTtl; }
    public void setLockTtl(Duration lockTtl) { this.lockTtl = lockTtl; }
    public Duration getLockRetryDelay() { return lockRetryDelay; }
    public void setLockRetryDelay(Duration lockRetryDelay) { this.lockRetryDelay = lockRetryDelay; }
    public int getLockMaxRetries() { return lockMaxRetries; }
    public void setLockMaxRetries(int lockMaxRetries) { this.lockMaxRetries = lockMaxRetries; }
    public Duration getQueryStatsTtl() { return queryStatsTtl; }
    public void setQueryStatsTtl(Duration queryStatsTtl) { this.queryStatsTtl = queryStatsTtl; }
    public int getTopQueries() { return topQueries; }
    public void setTopQueries(int topQueries) { this.topQueries = topQueries; }
  }

  public static class RateLimit {
    private boolean enabled = true;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
  }

  /** Scheduled pre-computation of common questions for a fixed set of tenants. */
  public static class Warmer {
    private boolean enabled;
    private int concurrency = 5;
    private Duration interval = Duration.ofHours(1);
    private String role = "company_admin";
    private List<String> companies = new ArrayList<>();
    private List<Query> queries = new ArrayList<>();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
    public Duration getInterval() { return interval; }
    public void setInterval(Duration interval) { this.interval = interval; }
    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }
    public List<String> getCompanies() { return companies; }
    public void setCompanies(List<String> companies) { this.companies = companies; }
    public List<Query> getQueries() { return queries; }
    public void setQueries(List<Query> queries) { this.queries = queries; }
  }

  /**
   * One warm-up question. {@code sql} and {@code analyticalQuery} may use {@code :companyId}, replaced with
   * the quoted tenant id.
   */
  public static class Query {
    private String question;
    private String templateId;
    private String sql;
    private String analyticalQuery;
    private Duration ttl;

    public String getQuestion() { return question; }
    public void setQuestion(String question) { this.question = question; }
    public String getTemplateId() { return templateId; }
    public void setTemplateId(String templateId) { this.templateId = templateId; }
    public String getSql() { return sql; }
    public void setSql(String sql) { this.sql = sql; }
    public String getAnalyticalQuery() { return analyticalQuery; }
    public void setAnalyticalQuery(String analyticalQuery) { this.analyticalQuery = analyticalQuery; }
    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }
  }
}
