package dev.granary.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("NullAway.Init")
class SourceSynchronizerTest {

  private static final String BIZINFO = "https://www.bizinfo.go.kr/web/lay1/bbs/list.do";

  @Mock SourceRepository sourceRepository;
  @Captor ArgumentCaptor<Source> sourceCaptor;

  @Test
  void unknownUrlCreatesSource() {
    SourceProperties properties =
        new SourceProperties(
            List.of(
                new SourceProperties.Entry(
                    "기업마당", BIZINFO, AdapterType.BROWSER, null, "table tbody tr", null)));
    when(sourceRepository.findByUrl(BIZINFO)).thenReturn(Optional.empty());

    int created = new SourceSynchronizer(sourceRepository, properties).synchronize();

    assertThat(created).isEqualTo(1);
    verify(sourceRepository).save(sourceCaptor.capture());
    Source saved = sourceCaptor.getValue();
    assertThat(saved.getUrl()).isEqualTo(BIZINFO);
    assertThat(saved.getName()).isEqualTo("기업마당");
    assertThat(saved.getAdapterType()).isEqualTo(AdapterType.BROWSER);
    assertThat(saved.isActive()).isTrue();
    assertThat(saved.getWaitSelector()).isEqualTo("table tbody tr");
  }

  @Test
  void knownUrlUpdatesExistingRow() {
    Source existing = new Source(BIZINFO, "옛 이름");
    SourceProperties properties =
        new SourceProperties(
            List.of(
                new SourceProperties.Entry(
                    "기업마당", BIZINFO, null, false, null, "https://bizinfo.go.kr/view?id={id}")));
    when(sourceRepository.findByUrl(BIZINFO)).thenReturn(Optional.of(existing));

    int created = new SourceSynchronizer(sourceRepository, properties).synchronize();

    assertThat(created).isZero();
    assertThat(existing.getName()).isEqualTo("기업마당");
    assertThat(existing.isActive()).isFalse();
    assertThat(existing.getDetailUrlTemplate()).isEqualTo("https://bizinfo.go.kr/view?id={id}");
    verify(sourceRepository).save(existing);
  }

  @Test
  void emptyConfigurationTouchesNothing() {
    int created =
        new SourceSynchronizer(sourceRepository, new SourceProperties(List.of())).synchronize();

    assertThat(created).isZero();
    verifyNoInteractions(sourceRepository);
  }
}
