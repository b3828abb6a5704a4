package io.intellixity.querywall.guardrails;

import io.intellixity.querywall.security.Role;
import io.intellixity.querywall.security.SecurityContext;
import io.intellixity.querywall.security.SecurityContextBuilder;
import io.intellixity.querywall.verify.Severity;
import io.intellixity.querywall.verify.VerificationResult;
import io.intellixity.querywall.verify.ViolationCode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class GuardrailValidatorTest {
  private static final String TENANT = "t-100";
  private static final String SAFE =
      "SELECT period_start, sroi_ratio FROM metrics_company_period "
          + "WHERE company_id = 't-100' AND period_start >= '2024-01-01' AND period_end <= '2024-12-31' "
          + "ORDER BY period_start LIMIT 100";

  private final GuardrailValidator validator = new GuardrailValidator();
  private final SecurityContext analyst = SecurityContextBuilder.build(TENANT, Role.ANALYST);

  @Test
  void safeQuery_isValid() {
    VerificationResult r = validator.validate(SAFE, analyst);
    assertTrue(r.valid(), r.toString());
    assertNull(r.highestSeverity());
  }

  @Test
  void limitAboveMax_isRejectedWithLimit002() {
    VerificationResult r = validator.validate(SAFE.replace("LIMIT 100", "LIMIT 50000"), analyst);
    assertEquals(java.util.List.of(ViolationCode.LIMIT_002), r.violationCodes());
  }

  @Test
  void missingLimit_isRejected() {
    VerificationResult r = validator.validate(SAFE.replace(" LIMIT 100", ""), analyst);
    assertTrue(r.hasViolation(ViolationCode.LIMIT_001));
  }

  @Test
  void fetchFirstCountsAsLimit() {
    VerificationResult r = validator.validate(SAFE.replace("LIMIT 100", "FETCH FIRST 20000 ROWS ONLY"), analyst);
    assertFalse(r.hasViolation(ViolationCode.LIMIT_001));
    assertTrue(r.hasViolation(ViolationCode.LIMIT_002));
  }

  @Test
  void configuredMaxLimit_isHonoured() {
    GuardrailValidator strict = new GuardrailValidator(GuardrailConfig.defaults().withMaxLimit(50));
    assertTrue(strict.validate(SAFE, analyst).hasViolation(ViolationCode.LIMIT_002));
  }

  @Test
  void missingWhere_isRejected() {
    VerificationResult r = validator.validate("SELECT * FROM metrics_company_period LIMIT 10", analyst);
    assertTrue(r.hasViolation(ViolationCode.WHERE_001));
    assertTrue(r.hasViolation(ViolationCode.TNT_001));
  }

  @Test
  void stackedStatement_isInjection() {
    VerificationResult r = validator.validate(SAFE + "; DROP TABLE users", analyst);
    assertTrue(r.hasViolation(ViolationCode.INJ_001));
    assertEquals(Severity.CRITICAL, r.highestSeverity());
  }

  @Test
  void comments_areRejected() {
    assertTrue(validator.validate(SAFE + " -- trailing", analyst).hasViolation(ViolationCode.CMT_001));
    assertTrue(validator.validate(SAFE.replace("SELECT", "SELECT /* x */"), analyst).hasViolation(ViolationCode.CMT_001));
  }

  @Test
  void dangerousFunctions_areRejected() {
    VerificationResult r = validator.validate(SAFE.replace("sroi_ratio", "pg_sleep(10)"), analyst);
    assertTrue(r.hasViolation(ViolationCode.FUNC_001));
  }

  @Test
  void exfiltration_isRejected() {
    VerificationResult r = validator.validate(SAFE.replace("sroi_ratio", "pg_read_file('/etc/passwd')"), analyst);
    assertTrue(r.hasViolation(ViolationCode.EXFIL_001));
  }

  @Test
  void deepNesting_isRejected() {
    String inner = "SELECT period_id FROM metrics_company_period WHERE company_id = 't-100'";
    String q = inner;
    for (int i = 0; i < 4; i++) {
      q = "SELECT period_id FROM metrics_company_period WHERE company_id = 't-100' AND period_id IN (" + q + ")";
    }
    VerificationResult r = validator.validate(q + " LIMIT 10", analyst);
    assertTrue(r.hasViolation(ViolationCode.NEST_001));
    assertEquals(4, GuardrailValidator.nestingDepth(SqlText.maskLiterals(q)));
  }

  @Test
  void functionParentheses_doNotCountAsNesting() {
    assertEquals(0, GuardrailValidator.nestingDepth("SELECT coalesce(max(a), (1 + 2)) FROM t"));
    assertEquals(1, GuardrailValidator.nestingDepth("SELECT a FROM t WHERE b IN ( select b FROM u)"));
  }

  @Test
  void timeWindowAbove730Days_isRejected() {
    VerificationResult r = validator.validate(SAFE.replace("'2024-01-01'", "'2020-01-01'"), analyst);
    assertTrue(r.hasViolation(ViolationCode.TIME_001));
  }

  @Test
  void tableOutsideRole_isRejected() {
    SecurityContext viewer = SecurityContextBuilder.build(TENANT, Role.VIEWER);
    String q = "SELECT avg(score) FROM outcome_scores WHERE company_id = 't-100' LIMIT 10";
    assertTrue(validator.validate(q, viewer).hasViolation(ViolationCode.TBL_001));
    assertFalse(validator.validate(q, analyst).hasViolation(ViolationCode.TBL_001));

    String denied = "SELECT email FROM public.users WHERE company_id = 't-100' LIMIT 10";
    assertTrue(validator.validate(denied, analyst).hasViolation(ViolationCode.TBL_001));
  }

  @Test
  void fromInsideFunctionArguments_isNotATable() {
    String q = "SELECT extract(year from period_start) AS y FROM metrics_company_period "
        + "WHERE company_id = 't-100' LIMIT 10";
    assertTrue(validator.validate(q, analyst).valid());
  }

  @Test
  void cteNames_areNotTables() {
    String q = "WITH recent AS (SELECT * FROM metrics_company_period WHERE company_id = 't-100') "
        + "SELECT * FROM recent WHERE sroi_ratio > 1 LIMIT 10";
    assertFalse(validator.validate(q, analyst).hasViolation(ViolationCode.TBL_001));
  }

  @Test
  void piiColumn_isRejected() {
    String q = "SELECT first_name, sroi_ratio FROM metrics_company_period WHERE company_id = 't-100' LIMIT 10";
    VerificationResult r = validator.validate(q, analyst);
    assertTrue(r.hasViolation(ViolationCode.PII_001));
    assertEquals(Severity.CRITICAL, r.highestSeverity());
  }

  @Test
  void piiColumnInPredicate_isRejected() {
    String q = SAFE.replace("AND period_start", "AND Email IS NOT NULL AND period_start");
    assertTrue(validator.validate(q, analyst).hasViolation(ViolationCode.PII_001));
  }

  @Test
  void piiWordInsideLiteral_isNotAColumn() {
    String q = SAFE.replace("AND period_start", "AND program = 'email outreach' AND period_start");
    assertFalse(validator.validate(q, analyst).hasViolation(ViolationCode.PII_001));
  }

  @Test
  void piiCheck_skipsSystemAdmin() {
    SecurityContext admin = SecurityContextBuilder.build(TENANT, Role.SYSTEM_ADMIN);
    String q = "SELECT email FROM users WHERE active = true LIMIT 10";
    assertTrue(validator.validate(q, admin).valid());
  }

  @Test
  void joinOnAllowList_passes() {
    String q = "SELECT m.sroi_ratio, o.score FROM metrics_company_period m "
        + "JOIN outcome_scores o ON o.period_id = m.period_id AND o.company_id = 't-100' "
        + "WHERE m.company_id = 't-100' LIMIT 10";
    VerificationResult r = validator.validate(q, analyst);
    assertFalse(r.hasViolation(ViolationCode.JOIN_001), r.toString());
  }

  @Test
  void joinOutsideAllowList_isRejected() {
    SecurityContext admin = SecurityContextBuilder.build(TENANT, Role.COMPANY_ADMIN);
    String q = "SELECT m.sroi_ratio FROM metrics_company_period m "
        + "JOIN evidence_snippets e ON e.period_id = m.period_id AND e.company_id = 't-100' "
        + "WHERE m.company_id = 't-100' LIMIT 10";
    VerificationResult r = validator.validate(q, admin);
    assertTrue(r.hasViolation(ViolationCode.JOIN_001), r.toString());
    assertFalse(r.hasViolation(ViolationCode.TBL_001));
  }

  @Test
  void joinsAreCheckedInsideSubqueries() {
    SecurityContext admin = SecurityContextBuilder.build(TENANT, Role.COMPANY_ADMIN);
    String q = SAFE.replace("AND period_start", "AND period_id IN (SELECT b.period_id FROM benchmarks_cohort_aggregates b "
        + "JOIN evidence_snippets e ON e.period_id = b.period_id WHERE b.company_id = 't-100') AND period_start");
    assertTrue(validator.validate(q, admin).hasViolation(ViolationCode.JOIN_001));
  }

  @Test
  void allViolations_areCollected() {
    VerificationResult r = validator.validate("SELECT * FROM users UNION SELECT * FROM api_keys -- x", analyst);
    assertTrue(r.violationCodes().containsAll(java.util.List.of(
        ViolationCode.TNT_001, ViolationCode.UNION_001, ViolationCode.CMT_001,
        ViolationCode.TBL_001, ViolationCode.WHERE_001, ViolationCode.LIMIT_001)));
  }
}
