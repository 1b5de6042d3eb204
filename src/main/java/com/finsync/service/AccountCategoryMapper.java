package com.finsync.service;

import com.finsync.exception.MappingException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Maps an aggregator's (type, subtype) taxonomy to an internal asset or liability category.
 * Lookup order: exact type and subtype, then type only, then the coarse asset/liability class
 * of the type. Anything else is a {@link MappingException}.
 */
@Component
public class AccountCategoryMapper {
  private static final Map<String, CategoryMapping> EXACT = new LinkedHashMap<>();
  private static final Set<String> ASSET_CLASS = Set.of("depository", "investment");
  private static final Set<String> LIABILITY_CLASS = Set.of("credit", "loan");

  static {
    asset("depository", "checking", "cash");
    asset("depository", "savings", "savings");
    asset("depository", "money market", "savings");
    asset("depository", "cd", "savings");
    asset("investment", "401k", "retirement_401k");
    asset("investment", "403b", "retirement_401k");
    asset("investment", "ira", "retirement_ira");
    asset("investment", "roth", "retirement_roth");
    asset("investment", "hsa", "retirement_hsa");
    asset("investment", "pension", "retirement_pension");
    asset("investment", "brokerage", "brokerage");
    asset("investment", "529", "other");
    asset("other", "other", "other");
    liability("credit", "credit card", "credit_card");
    liability("loan", "auto", "auto_loan");
    liability("loan", "student", "student_loan");
    liability("loan", "mortgage", "mortgage");
    liability("loan", "personal", "personal_loan");
  }

  public CategoryMapping map(String type, String subtype) {
    String normalizedType = normalize(type);
    String normalizedSubtype = normalize(subtype);

    CategoryMapping exact = EXACT.get(key(normalizedType, normalizedSubtype));
    if (exact != null) {
      return exact;
    }
    // type-only rows are registered with an empty subtype
    CategoryMapping typeOnly = EXACT.get(key(normalizedType, ""));
    if (typeOnly != null) {
      return typeOnly;
    }
    if (ASSET_CLASS.contains(normalizedType)) {
      return new CategoryMapping("other", true);
    }
    if (LIABILITY_CLASS.contains(normalizedType)) {
      return new CategoryMapping("other", false);
    }
    throw new MappingException(type, subtype);
  }

  private static void asset(String type, String subtype, String category) {
    EXACT.put(key(type, subtype), new CategoryMapping(category, true));
  }

  private static void liability(String type, String subtype, String category) {
    EXACT.put(key(type, subtype), new CategoryMapping(category, false));
  }

  private static String key(String type, String subtype) {
    return type + "|" + subtype;
  }

  private static String normalize(String value) {
    return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
  }

  public record CategoryMapping(String category, boolean asset) {}
}
