package ca.gc.cra.formdata.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class EncoderConfigTest {
  @Test
  void defaultsUseOctetStreamAndPlaceholderFilename() {
    EncoderConfig config = EncoderConfig.defaults();

    assertEquals("application/octet-stream", config.defaultFileContentType());
    assertEquals("file", config.defaultFilename());
    assertEquals(64, config.maxDepth());
  }

  @Test
  void valuesAreTrimmed() {
    EncoderConfig config = new EncoderConfig(" text/plain ", " upload.bin ", 8);

    assertEquals("text/plain", config.defaultFileContentType());
    assertEquals("upload.bin", config.defaultFilename());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> new EncoderConfig("text/é", "f", 8));
    assertThrows(IllegalArgumentException.class, () -> new EncoderConfig("text/plain", "  ", 8));
    assertThrows(IllegalArgumentException.class, () -> new EncoderConfig("text/plain\r\n", "f", 8));
    assertThrows(IllegalArgumentException.class, () -> new EncoderConfig("text/plain", "f", 0));
    assertThrows(IllegalArgumentException.class, () -> new EncoderConfig("text/plain", "f", 5000));
    assertThrows(NullPointerException.class, () -> new EncoderConfig(null, "f", 8));
  }
}
