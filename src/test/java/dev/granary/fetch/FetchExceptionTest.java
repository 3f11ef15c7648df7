package dev.granary.fetch;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FetchExceptionTest {

  @ParameterizedTest
  @CsvSource({
    "403, BLOCKED",
    "429, BLOCKED",
    "401, BLOCKED",
    "404, TRANSIENT",
    "500, TRANSIENT",
    "503, TRANSIENT"
  })
  void statusCodesMapToKinds(int status, FetchException.Kind expected) {
    FetchException e = FetchException.forStatus("https://example.com/list", status);

    assertThat(e.getKind()).isEqualTo(expected);
    assertThat(e.getUrl()).isEqualTo("https://example.com/list");
    assertThat(e.getMessage()).contains(String.valueOf(status));
  }
}
