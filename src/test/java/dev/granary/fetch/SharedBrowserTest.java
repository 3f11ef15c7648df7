package dev.granary.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SharedBrowserTest {

  private static final String URL = "https://www.gntp.or.kr/biz/apply";

  @Test
  void errorStatusWithTableIsStillUsable() {
    String html = "<html><body><table><tr><td>공고</td></tr></table></body></html>";

    assertThatCode(() -> SharedBrowser.checkRendered(URL, 500, html)).doesNotThrowAnyException();
  }

  @Test
  void errorStatusWithLargePageIsStillUsable() {
    String html = "<div>" + "가".repeat(SharedBrowser.USABLE_ERROR_PAGE_LENGTH) + "</div>";

    assertThatCode(() -> SharedBrowser.checkRendered(URL, 404, html)).doesNotThrowAnyException();
  }

  @Test
  void forbiddenWithoutContentIsBlocked() {
    assertThatThrownBy(() -> SharedBrowser.checkRendered(URL, 403, "<html>denied</html>"))
        .isInstanceOf(FetchException.class)
        .extracting(e -> ((FetchException) e).getKind())
        .isEqualTo(FetchException.Kind.BLOCKED);
  }

  @Test
  void shortErrorStubIsBlockedEvenWithOkStatus() {
    assertThatThrownBy(
            () -> SharedBrowser.checkRendered(URL, 200, "<html><h1>Request Error</h1></html>"))
        .isInstanceOf(FetchException.class);
  }

  @Test
  void releaseWithoutStartIsNoOp() {
    FetchProperties properties =
        new FetchProperties("granary-test", 1_000, 1_000, 1_000, 500, 0, 1, true);
    SharedBrowser browser = new SharedBrowser(properties);

    browser.release();

    assertThat(browser.isRunning()).isFalse();
  }
}
