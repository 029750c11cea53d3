package dev.librarian.classification;

import java.util.List;
import java.util.Set;

/**
 * The default, ordered heuristic rule table.
 *
 * <p>Order is the tie-break: the first rule that fires wins, so narrower categories come before
 * broader ones sharing their vocabulary (paystubs mention "federal" withholding, W-2 appears in
 * both the tax and employment rules). Reordering changes classification output.
 */
public final class HeuristicRules {

  private HeuristicRules() {
    // constants
  }

  public static final HeuristicRule PAYSTUB =
      new HeuristicRule(
          List.of("paystub", "pay stub", "paycheck", "earnings statement", "salary", "earnings"),
          "KB.Finance.Income",
          "Paystub detected",
          2,
          Set.of("paystub", "paystubs", "payroll", "pay", "income", "salary"));

  public static final HeuristicRule TAXES =
      new HeuristicRule(
          List.of(
              "1040", "w-2", "w2", "1099", "w-9", "w9", "tax return", "irs", "federal",
              "state tax"),
          "KB.Finance.Taxes",
          "Tax form detected",
          2,
          Set.of("tax", "taxes", "irs", "federal", "state", "return"));

  public static final HeuristicRule REAL_ESTATE =
      new HeuristicRule(
          List.of(
              "deed", "closing disclosure", "hud-1", "hud1", "mortgage", "property tax", "escrow"),
          "KB.Assets.RealEstate",
          "Real estate document detected",
          2,
          Set.of("real", "estate", "property", "house", "home", "mortgage", "deed"));

  public static final HeuristicRule INSURANCE =
      new HeuristicRule(
          List.of("policy", "insurance", "life insurance", "term life", "disability", "coverage"),
          "KB.Finance.Insurance",
          "Insurance document detected",
          1,
          Set.of("insurance", "policy", "coverage", "life", "health"));

  public static final HeuristicRule IDENTITY =
      new HeuristicRule(
          List.of(
              "birth certificate", "passport", "ssn", "social security", "driver", "license",
              "drivers license"),
          "KB.Personal.Identity",
          "Identity document detected",
          2,
          Set.of("identity", "id", "personal", "passport", "license", "ssn"));

  public static final HeuristicRule ESTATE =
      new HeuristicRule(
          List.of(
              "will", "trust", "power of attorney", "poa", "estate plan", "living will",
              "testament"),
          "KB.Personal.Estate",
          "Estate planning document detected",
          2,
          Set.of("estate", "will", "trust", "legal", "attorney"));

  public static final HeuristicRule EMPLOYMENT =
      new HeuristicRule(
          List.of(
              "employment agreement", "offer letter", "employment contract", "rsu", "espp", "w-2",
              "w2"),
          "KB.Work.Employment",
          "Employment document detected",
          1,
          Set.of("work", "employment", "job", "career", "company", "employer"));

  public static final HeuristicRule BANKING =
      new HeuristicRule(
          List.of("bank statement", "checking", "savings", "account statement", "routing"),
          "KB.Finance.Banking",
          "Banking document detected",
          1,
          Set.of("bank", "banking", "checking", "savings", "account", "chase", "wells", "bofa"));

  public static final HeuristicRule INVESTMENTS =
      new HeuristicRule(
          List.of(
              "brokerage", "401k", "ira", "investment", "portfolio", "k-1", "k1", "fidelity",
              "vanguard"),
          "KB.Finance.Investments",
          "Investment document detected",
          1,
          Set.of("investment", "brokerage", "portfolio", "stocks", "retirement", "401k", "ira"));

  public static final HeuristicRule HEALTH =
      new HeuristicRule(
          List.of(
              "medical", "health", "vaccination", "doctor", "hospital", "prescription", "eob"),
          "KB.Personal.Health",
          "Health document detected",
          1,
          Set.of("health", "medical", "doctor", "hospital", "healthcare"));

  public static final HeuristicRule VEHICLES =
      new HeuristicRule(
          List.of("vehicle", "auto", "car", "registration", "title", "dmv"),
          "KB.Assets.Vehicles",
          "Vehicle document detected",
          1,
          Set.of("vehicle", "auto", "car", "dmv", "registration", "title"));

  /** Rules in priority order. */
  public static List<HeuristicRule> defaults() {
    return List.of(
        PAYSTUB,
        TAXES,
        REAL_ESTATE,
        INSURANCE,
        IDENTITY,
        ESTATE,
        EMPLOYMENT,
        BANKING,
        INVESTMENTS,
        HEALTH,
        VEHICLES);
  }
}
