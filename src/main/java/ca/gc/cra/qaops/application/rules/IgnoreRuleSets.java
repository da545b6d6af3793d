package ca.gc.cra.qaops.application.rules;

import java.util.List;

/**
 * Named rule sets injected when a product configures no ignore rules of its own.
 *
 * @since 0.1.0
 */
public final class IgnoreRuleSets {
  /** Drops forwarded AWS notification e-mails that carry no alarm. */
  public static final List<IgnoreRule> DEFAULTS = List.of(IgnoreRule.of("AWS Notification Message", "files.name"));

  private IgnoreRuleSets() {
    // Utility
  }
}
