package dev.granary.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class IndexSourceTypeTest {

  @ParameterizedTest
  @CsvSource({
    "announcement, ANNOUNCEMENT",
    "ATTACHMENT, ATTACHMENT",
    "Attachment, ATTACHMENT"
  })
  void parsesValuesIgnoringCase(String value, IndexSourceType expected) {
    assertThat(IndexSourceType.fromValue(value)).isEqualTo(expected);
  }

  @ParameterizedTest
  @CsvSource({"document", "''"})
  void rejectsUnknownValues(String value) {
    assertThatIllegalArgumentException().isThrownBy(() -> IndexSourceType.fromValue(value));
  }
}
