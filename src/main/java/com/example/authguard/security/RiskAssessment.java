package com.example.authguard.security;

import java.util.List;

/**
 * Advisory risk signal. Never a reason to reject a request on its own.
 */
public record RiskAssessment(boolean suspicious, List<String> reasons, int riskScore) {

  public static RiskAssessment clean() {
    return new RiskAssessment(false, List.of(), 0);
  }
}
