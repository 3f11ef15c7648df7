package dev.granary.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.Charset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class PlainHttpFetcherTest {

  private static final String URL = "https://portal.example.com/board/list.do";

  private MockRestServiceServer server;
  private PlainHttpFetcher fetcher;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    fetcher = new PlainHttpFetcher(builder.build());
  }

  @Test
  void decodesBodyWithDeclaredCharset() {
    Charset eucKr = Charset.forName("EUC-KR");
    byte[] body = "<html><body><p>창업 지원 공고</p></body></html>".getBytes(eucKr);
    server
        .expect(requestTo(URL))
        .andRespond(withSuccess(body, new MediaType("text", "html", eucKr)));

    FetchedPage page = fetcher.fetch(URL);

    assertThat(page.html()).contains("창업 지원 공고");
    assertThat(page.finalUrl()).isEqualTo(URL);
    server.verify();
  }

  @Test
  void forbiddenResponseIsBlocked() {
    server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertThatThrownBy(() -> fetcher.fetch(URL))
        .isInstanceOf(FetchException.class)
        .extracting(e -> ((FetchException) e).getKind())
        .isEqualTo(FetchException.Kind.BLOCKED);
  }

  @Test
  void serverErrorIsTransient() {
    server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

    assertThatThrownBy(() -> fetcher.fetch(URL))
        .isInstanceOf(FetchException.class)
        .extracting(e -> ((FetchException) e).getKind())
        .isEqualTo(FetchException.Kind.TRANSIENT);
  }

  @Test
  void socketTimeoutClassifiesAsTimeout() {
    ResourceAccessException e =
        new ResourceAccessException("Read timed out", new SocketTimeoutException("timeout"));

    assertThat(PlainHttpFetcher.classify(URL, e).getKind()).isEqualTo(FetchException.Kind.TIMEOUT);
  }

  @Test
  void otherIoErrorsClassifyAsTransient() {
    ResourceAccessException e =
        new ResourceAccessException("Connection reset", new IOException("reset"));

    assertThat(PlainHttpFetcher.classify(URL, e).getKind())
        .isEqualTo(FetchException.Kind.TRANSIENT);
  }

  @Test
  void alreadyEncodedLinksAreNotEncodedTwice() {
    assertThat(PlainHttpFetcher.toUri("https://x.kr/a?q=%EC%B0%BD%EC%97%85").toString())
        .isEqualTo("https://x.kr/a?q=%EC%B0%BD%EC%97%85");
  }
}
