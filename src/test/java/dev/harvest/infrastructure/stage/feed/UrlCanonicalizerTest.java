package dev.harvest.infrastructure.stage.feed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class UrlCanonicalizerTest {

  @Test
  void lowercasesSchemeAndHostAndDropsDefaultPort() {
    assertEquals(Optional.of("https://jobs.example/Open/1"),
        UrlCanonicalizer.canonicalize("HTTPS://Jobs.Example:443/Open/1"));
  }

  @Test
  void stripsTrackingParametersAndFragments() {
    assertEquals(Optional.of("https://jobs.example/1?id=4"),
        UrlCanonicalizer.canonicalize("https://jobs.example/1?utm_source=rss&id=4&UTM_medium=x#apply"));
    assertEquals(Optional.of("https://jobs.example/1"),
        UrlCanonicalizer.canonicalize("https://jobs.example/1?utm_campaign=spring"));
  }

  @Test
  void keepsNonDefaultPortAndAddsRootPath() {
    assertEquals(Optional.of("http://jobs.example:8080/"), UrlCanonicalizer.canonicalize(" http://jobs.example:8080 "));
  }

  @Test
  void rejectsUnusableLinks() {
    assertTrue(UrlCanonicalizer.canonicalize("").isEmpty());
    assertTrue(UrlCanonicalizer.canonicalize(null).isEmpty());
    assertTrue(UrlCanonicalizer.canonicalize("mailto:jobs@example.org").isEmpty());
    assertTrue(UrlCanonicalizer.canonicalize("/relative/path").isEmpty());
    assertTrue(UrlCanonicalizer.canonicalize("https://bad host/").isEmpty());
  }
}
