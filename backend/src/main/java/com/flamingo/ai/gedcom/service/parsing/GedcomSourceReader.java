package com.flamingo.ai.gedcom.service.parsing;

import com.flamingo.ai.gedcom.exception.GedcomSourceException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Reads GEDCOM text into physical lines.
 *
 * <p>Decoding is UTF-8 with malformed and unmappable sequences replaced by U+FFFD, so a broken byte
 * never aborts a load. A leading byte-order mark is dropped and {@code \n}, {@code \r\n} and {@code
 * \r} all end a line.
 */
@Component
public class GedcomSourceReader {

  private static final char BOM = '\uFEFF';

  /**
   * Reads all lines of a stream. The caller keeps ownership of {@code inputStream}.
   *
   * @throws GedcomSourceException if the stream cannot be read
   */
  public List<String> readLines(InputStream inputStream) {
    try {
      return decode(inputStream.readAllBytes()).lines().toList();
    } catch (IOException e) {
      throw new GedcomSourceException("Failed to read GEDCOM input: " + e.getMessage(), e);
    }
  }

  /**
   * Reads all lines of a file.
   *
   * @throws GedcomSourceException if the file cannot be read
   */
  public List<String> readLines(Path path) {
    try {
      return decode(Files.readAllBytes(path)).lines().toList();
    } catch (IOException e) {
      throw new GedcomSourceException("Failed to read " + path + ": " + e.getMessage(), e);
    }
  }

  String decode(byte[] bytes) throws CharacterCodingException {
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    String text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
    return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
  }
}
