package playlog.jdbc;

import java.util.List;

/**
 * Outcome of {@link PlayStore#checkIntegrity()}.
 *
 * @param healthy {@code true} when no issue was found
 * @param issues  human-readable problems, empty when healthy
 */
public record IntegrityReport(boolean healthy, List<String> issues) {

  public IntegrityReport {
    issues = List.copyOf(issues);
  }

  public static IntegrityReport of(List<String> issues) {
    return new IntegrityReport(issues.isEmpty(), issues);
  }
}
