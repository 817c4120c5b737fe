package com.example.datalake.prodbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Structured chat commands, written as {@code -t <product id> [filter]}.
 */
public enum CommandType {
  TECHNICAL('t'),
  COMPATIBILITY('c'),
  SUMMARY('s'),
  FULL_INFO('f');

  private final char letter;

  CommandType(char letter) {
    this.letter = letter;
  }

  public char letter() {
    return letter;
  }

  @JsonValue
  public String flag() {
    return "-" + letter;
  }

  public static Optional<CommandType> fromFlag(String flag) {
    if (flag == null) return Optional.empty();
    String f = flag.strip();
    if (f.length() != 2 || f.charAt(0) != '-') return Optional.empty();
    for (CommandType type : values()) {
      if (type.letter == f.charAt(1)) return Optional.of(type);
    }
    return Optional.empty();
  }
}
