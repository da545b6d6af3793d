package ca.gc.cra.qaops.application.extract;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.qaops.config.ConfigurationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class MessageExtractorRegistryTest {
  private final MessageExtractorRegistry registry = MessageExtractorRegistry.standard();

  @Test
  void resolvesExactPair() {
    MessageExtractor extractor = registry.resolve("SEND", "uat");
    assertInstanceOf(TitleAlarmExtractor.class, extractor);
    assertEquals(new ProductEnvironment("SEND", "uat"), extractor.productEnvironment());
    assertInstanceOf(FileAttachmentExtractor.class, registry.resolve("interop", "TEST"));
  }

  @Test
  void fallsBackToProductionExtractor() {
    MessageExtractor extractor = registry.resolve("SEND", "staging");
    assertEquals(new ProductEnvironment("SEND", "prod"), extractor.productEnvironment());
  }

  @Test
  void unsupportedProductIsConfigurationError() {
    ConfigurationException ex =
        assertThrows(ConfigurationException.class, () -> registry.resolve("BILLING", "prod"));
    assertTrue(ex.getMessage().contains("BILLING"));
  }

  @Test
  void rejectsDuplicateRegistrations() {
    ProductEnvironment key = new ProductEnvironment("SEND", "prod");
    assertThrows(IllegalArgumentException.class, () -> new MessageExtractorRegistry(
        List.of(new TitleAlarmExtractor(key), new FileAttachmentExtractor(key))));
  }

  @Test
  void listsSupportedPairs() {
    assertEquals(4, registry.supported().size());
    assertEquals("SEND-prod", registry.supported().get(0).toString());
  }
}
