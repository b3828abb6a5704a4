package io.intellixity.querywall.service.config;

import io.intellixity.querywall.cache.CacheWarmer;
import io.intellixity.querywall.cache.WarmupReport;
import io.intellixity.querywall.engine.QueryExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Re-warms the configured questions for the configured tenants on a fixed delay. */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "querywall.warmer", name = "enabled", havingValue = "true")
public class WarmupScheduler {
  private static final Logger log = LoggerFactory.getLogger(WarmupScheduler.class);

  private final CacheWarmer<QueryExecutionResult> warmer;
  private final QueryWallProperties props;

  public WarmupScheduler(CacheWarmer<QueryExecutionResult> warmer, QueryWallProperties props) {
    this.warmer = warmer;
    this.props = props;
  }

  @Scheduled(initialDelayString = "${querywall.warmer.initial-delay:PT30S}",
      fixedDelayString = "${querywall.warmer.interval:PT1H}")
  public void warm() {
    if (props.getWarmer().getCompanies().isEmpty()) return;
    WarmupReport r = warmer.warmup(props.getWarmer().getCompanies());
    log.info("querywall.warmup op=scheduled ran={} companies={} warmed={} skipped={} failed={} durationMs={}",
        r.ran(), r.companies(), r.warmed(), r.skipped(), r.failed(), r.durationMs());
  }
}
