package com.ospicorp.kpimonitor.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Header-row CSV reading and write-then-replace writing for the file stores.
 */
final class CsvFiles {
  private static final Logger log = LoggerFactory.getLogger(CsvFiles.class);
  private static final CsvMapper MAPPER = createMapper();

  private CsvFiles() {
  }

  static CsvMapper mapper() {
    return MAPPER;
  }

  static <T> List<T> read(Path file, Class<T> type) throws IOException {
    if (!Files.exists(file) || Files.size(file) == 0) return List.of();
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    List<T> out = new ArrayList<>();
    try (MappingIterator<T> it = MAPPER.readerFor(type).with(schema).readValues(file.toFile())) {
      long lastFailure = -1;
      while (true) {
        try {
          if (!it.hasNextValue()) break;
          out.add(it.nextValue());
        } catch (JsonProcessingException ex) {
          long offset = it.getCurrentLocation().getCharOffset();
          if (offset == lastFailure) {
            log.warn("Stopped reading {} at char {}: parser cannot resync", file, offset);
            break;
          }
          lastFailure = offset;
          log.warn("Skipping unreadable row in {} near line {}: {}", file,
              ex.getLocation() == null ? "?" : ex.getLocation().getLineNr(), ex.getOriginalMessage());
        }
      }
    }
    return out;
  }

  static <T> void write(Path file, Class<T> type, List<? extends T> rows) throws IOException {
    Path dir = file.toAbsolutePath().getParent();
    Files.createDirectories(dir);
    CsvSchema schema = MAPPER.schemaFor(type).withHeader();
    Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
    try {
      try (Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
        if (rows.isEmpty()) {
          out.write(header(schema));
        } else {
          SequenceWriter writer = MAPPER.writer(schema).writeValues(out);
          for (T row : rows) {
            writer.write(row);
          }
          writer.flush();
        }
      }
      replace(tmp, file);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  private static void replace(Path tmp, Path target) throws IOException {
    try {
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static String header(CsvSchema schema) {
    StringJoiner joiner = new StringJoiner(",", "", "\n");
    for (CsvSchema.Column column : schema) {
      joiner.add(column.getName());
    }
    return joiner.toString();
  }

  private static CsvMapper createMapper() {
    CsvMapper mapper = new CsvMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.enable(CsvParser.Feature.EMPTY_STRING_AS_NULL);
    mapper.enable(CsvParser.Feature.TRIM_SPACES);
    return mapper;
  }
}
