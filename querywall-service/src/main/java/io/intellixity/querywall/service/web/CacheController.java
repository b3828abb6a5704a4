package io.intellixity.querywall.service.web;

import io.intellixity.querywall.cache.CacheStats;
import io.intellixity.querywall.cache.CacheWarmer;
import io.intellixity.querywall.cache.ResultCache;
import io.intellixity.querywall.cache.WarmupReport;
import io.intellixity.querywall.engine.QueryExecutionResult;
import io.intellixity.querywall.security.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/cache")
public final class CacheController {
  private static final Logger log = LoggerFactory.getLogger(CacheController.class);

  private final ResultCache<QueryExecutionResult> cache;
  private final CacheWarmer<QueryExecutionResult> warmer;

  public CacheController(ResultCache<QueryExecutionResult> cache, CacheWarmer<QueryExecutionResult> warmer) {
    this.cache = cache;
    this.warmer = warmer;
  }

  public record InvalidationResponse(String scope, String target, long deleted) {}

  public record WarmupRequest(List<String> companyIds, List<String> templateIds) {}

  @GetMapping("/stats")
  public CacheStats stats() {
    return cache.stats();
  }

  /** Tenants may drop their own entries; a system admin may drop anyone's. */
  @DeleteMapping("/tenants/{tenantId}")
  public InvalidationResponse invalidateTenant(@RequestHeader(QueryController.TENANT_HEADER) String callerTenant,
                                               @RequestHeader(value = QueryController.ROLE_HEADER, required = false) String role,
                                               @PathVariable("tenantId") String tenantId) {
    if (Role.parse(role) != Role.SYSTEM_ADMIN && !tenantId.equals(callerTenant.trim())) {
      throw new ForbiddenOperationException("Cannot invalidate another tenant's cache");
    }
    long deleted = cache.invalidateByTenant(tenantId);
    log.info("querywall.cache op=invalidate scope=tenant tenant={} caller={} deleted={}", tenantId, callerTenant, deleted);
    return new InvalidationResponse("tenant", tenantId, deleted);
  }

  @DeleteMapping("/templates/{templateId}")
  public InvalidationResponse invalidateTemplate(@RequestHeader(value = QueryController.ROLE_HEADER, required = false) String role,
                                                 @PathVariable("templateId") String templateId) {
    requireSystemAdmin(role);
    long deleted = cache.invalidateByTemplate(templateId);
    log.info("querywall.cache op=invalidate scope=template template={} deleted={}", templateId, deleted);
    return new InvalidationResponse("template", templateId, deleted);
  }

  /** Runs a warmup now. Without {@code templateIds} every configured question is warmed. */
  @PostMapping("/warmup")
  public WarmupReport warmup(@RequestHeader(value = QueryController.ROLE_HEADER, required = false) String role,
                             @RequestBody WarmupRequest req) {
    requireSystemAdmin(role);
    if (req == null || req.companyIds() == null || req.companyIds().isEmpty()) {
      throw new IllegalArgumentException("companyIds is required");
    }
    if (req.templateIds() == null || req.templateIds().isEmpty()) {
      return warmer.warmup(req.companyIds());
    }
    return warmer.warmupTemplates(req.templateIds(), req.companyIds());
  }

  private static void requireSystemAdmin(String role) {
    if (Role.parse(role) != Role.SYSTEM_ADMIN) {
      throw new ForbiddenOperationException("Requires the system_admin role");
    }
  }
}
