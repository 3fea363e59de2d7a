package com.gentoro.endnotemcp;

import com.gentoro.endnotemcp.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line parameters. Options are {@code --name value} pairs; the switches listed in {@link
 * #FLAGS} take no value and are recorded as {@code "true"}. Short aliases follow the usual EndNote
 * MCP invocation: {@code -e}, {@code -d}, {@code -l}, {@code -b}.
 */
public class StartupParameters {

  public static final String ENL_FILE = "enl-file";
  public static final String DATA_FOLDER = "data-folder";
  public static final String ENABLE_LOG = "enable-log";
  public static final String USE_BACKUP = "use-backup";
  public static final String CONFIG_FILE = "config-file";
  public static final String MODE = "mode";

  static final Set<String> FLAGS = Set.of(ENABLE_LOG, USE_BACKUP);
  static final Set<String> MODES = Set.of("stdio", "server", "help");

  private static final Map<String, String> ALIASES =
      Map.of("e", ENL_FILE, "d", DATA_FOLDER, "l", ENABLE_LOG, "b", USE_BACKUP);

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put(CONFIG_FILE, "classpath:application.yaml");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      String paramName = optionName(arguments[p]);
      if (paramName == null) {
        continue;
      }

      if (FLAGS.contains(paramName)) {
        result.put(paramName, "true");
        continue;
      }

      String paramValue = null;
      if (p < arguments.length - 1 && optionName(arguments[p + 1]) == null) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private static String optionName(String argument) {
    if (argument == null) return null;
    if (argument.startsWith("--") && argument.length() > 2) {
      return argument.substring(2);
    }
    if (argument.startsWith("-") && ALIASES.containsKey(argument.substring(1))) {
      return ALIASES.get(argument.substring(1));
    }
    return null;
  }

  private void validate() {
    Object mode = parameters.get(MODE);
    if (parameters.containsKey(MODE) && (mode == null || !MODES.contains(mode.toString()))) {
      throw new ValidationException("Invalid mode: " + mode);
    }

    if (parameters.get(CONFIG_FILE) == null
        || parameters.get(CONFIG_FILE).toString().isBlank()) {
      throw new ValidationException("Missing config file location");
    }

    for (String valued : new String[] {ENL_FILE, DATA_FOLDER}) {
      if (parameters.containsKey(valued)
          && (parameters.get(valued) == null || parameters.get(valued).toString().isBlank())) {
        throw new ValidationException("Missing value for --" + valued);
      }
    }
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/endnote-mcp.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter(CONFIG_FILE, String.class).orElse("classpath:application.yaml");
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isFlagSet(String name) {
    return FLAGS.contains(name) && "true".equals(parameters.get(name));
  }

  public static String usage() {
    return """
        Usage: endnote-mcp --enl-file <library.enl> --data-folder <library.Data> [options]

          -e, --enl-file <path>      Path to the EndNote .enl file
          -d, --data-folder <path>   Path to the EndNote .Data folder
          -l, --enable-log           Enable detailed diagnostic logging
          -b, --use-backup           Read from <enl-file>.backup, refreshed at startup
              --config-file <loc>    YAML configuration (default classpath:application.yaml)
              --mode <mode>          stdio (default), server or help
        """;
  }
}
