package com.example.datalake.prodbot.service;

import com.example.datalake.prodbot.model.CommandType;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes {@code -t|-c|-s|-f <product id> [params]} input.
 */
public final class CommandParser {

  private static final Pattern COMMAND = Pattern.compile("^(-[tcfs])\\s+(\\S+)(.*)$", Pattern.DOTALL);

  private CommandParser() {}

  public static Optional<ParsedCommand> parse(String input) {
    if (input == null) return Optional.empty();
    Matcher m = COMMAND.matcher(input.strip());
    if (!m.matches()) return Optional.empty();
    return CommandType.fromFlag(m.group(1))
        .map(type -> new ParsedCommand(type, m.group(2), m.group(3).strip()));
  }

  public static boolean isCommand(String input) {
    return parse(input).isPresent();
  }

  public record ParsedCommand(CommandType command, String productId, String params) {

    public String cacheKey() {
      return command.flag() + ":" + productId + ":" + params;
    }
  }
}
