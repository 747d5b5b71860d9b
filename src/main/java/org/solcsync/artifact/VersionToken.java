/* Copyright 2026 The solc-sync Developers
 * See LICENSE for licensing information */

package org.solcsync.artifact;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser and validator for compiler version tokens of the canonical form
 * {@code v<major>.<minor>.<patch>+commit.<hex>}.
 */
public final class VersionToken {

  /** Canonical token, also embedded as is in published file names. */
  public static final String TOKEN_REGEX
      = "v\\d+\\.\\d+\\.\\d+\\+commit\\.[0-9a-f]+";

  private static final Pattern CANONICAL = Pattern.compile(TOKEN_REGEX);

  /**
   * Version line printed by {@code solc --version}, e.g.
   * {@code Version: 0.8.29-develop.2025.9.18+commit.d4b8c7ae.Darwin.appleclang}.
   * The prerelease part between patch level and "+commit." as well as the
   * platform suffix after the commit hash are dropped.
   */
  private static final Pattern COMPILER_OUTPUT = Pattern.compile(
      "Version:\\s*(\\d+\\.\\d+\\.\\d+)(?:-[^+\\s]*)?\\+commit\\.([0-9a-f]+)");

  private VersionToken() {
  }

  /**
   * Extract the canonical version token from the standard output of a
   * compiler asked for its version.
   *
   * @param output Text printed by the compiler.
   * @return Canonical version token, or empty if the output does not contain
   *     a recognizable version with commit hash.
   */
  public static Optional<String> fromCompilerOutput(String output) {
    if (null == output) {
      return Optional.empty();
    }
    Matcher matcher = COMPILER_OUTPUT.matcher(output);
    if (!matcher.find()) {
      return Optional.empty();
    }
    return Optional.of("v" + matcher.group(1) + "+commit." + matcher.group(2));
  }

  /** Returns {@code true}, if the given string is a canonical token. */
  public static boolean isWellFormed(String version) {
    return null != version && CANONICAL.matcher(version).matches();
  }
}
