package ca.gc.cra.logship.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into positional/{@code key=value} tokens and {@code --flags}.
 *
 * <p>{@code --help}, {@code -h}, and {@code help} normalize to {@code --help}; {@code --verbose}, {@code -v}, and
 * {@code --debug} normalize to {@code --verbose}.</p>
 */
public final class CliInput {
  static final String HELP = "--help";
  static final String VERBOSE = "--verbose";
  private static final Set<String> HELP_ALIASES = Set.of(HELP, "-h", "help");
  private static final Set<String> VERBOSE_ALIASES = Set.of(VERBOSE, "-v", "--debug");

  private final List<String> arguments;
  private final Set<String> flags;

  private CliInput(List<String> arguments, Set<String> flags) {
    this.arguments = List.copyOf(arguments);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments. Blank and {@code null} entries are skipped.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> arguments = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_ALIASES.contains(lower)) {
          flags.add(HELP);
        } else if (VERBOSE_ALIASES.contains(lower)) {
          flags.add(VERBOSE);
        } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
          flags.add(lower);
        } else {
          arguments.add(arg);
        }
      }
    }
    return new CliInput(arguments, flags);
  }

  /** @return non-flag arguments in their original order */
  public List<String> arguments() {
    return arguments;
  }

  /** @return {@code true} if help output was requested */
  public boolean help() {
    return flags.contains(HELP);
  }

  /** @return {@code true} when verbose diagnostics were requested */
  public boolean verbose() {
    return flags.contains(VERBOSE);
  }

  /**
   * @param flag flag such as {@code --dry-run} (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
