package com.example.datalake.prodbot.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one JSON object per line. Malformed lines are logged and skipped; only I/O
 * failures abort the read.
 */
@Slf4j
public class JsonlReader {

  private final ObjectMapper mapper;

  public JsonlReader(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public <T> List<T> read(Path file, Class<T> type) throws IOException {
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    List<T> out = new ArrayList<>(lines.size());
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).strip();
      if (line.isEmpty()) continue;
      try {
        T value = mapper.readValue(line, type);
        if (value != null) out.add(value);
      } catch (JsonProcessingException ex) {
        log.warn("Skipping malformed line {} in {}: {}", i + 1, file, ex.getOriginalMessage());
      }
    }
    return out;
  }
}
